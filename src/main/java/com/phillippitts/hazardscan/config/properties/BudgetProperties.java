package com.phillippitts.hazardscan.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Cloud spend caps. Daily and monthly windows roll over at calendar boundaries in {@code zone}.
 */
@ConfigurationProperties(prefix = "hazardscan.budget")
@Validated
public class BudgetProperties {

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal dailyCap = new BigDecimal("5.00");

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal monthlyCap = new BigDecimal("100.00");

    @NotNull
    private ZoneId zone = ZoneId.of("UTC");

    public BigDecimal getDailyCap() {
        return dailyCap;
    }

    public void setDailyCap(BigDecimal dailyCap) {
        this.dailyCap = dailyCap;
    }

    public BigDecimal getMonthlyCap() {
        return monthlyCap;
    }

    public void setMonthlyCap(BigDecimal monthlyCap) {
        this.monthlyCap = monthlyCap;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }
}
