package com.phillippitts.hazardscan.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of monetary spend against the daily and monthly caps.
 *
 * <p>Mutated only by {@link com.phillippitts.hazardscan.service.budget.BudgetManager}. Reserved
 * amounts count against both caps until they are committed or released.
 */
public record BudgetState(
        BigDecimal dailySpend,
        BigDecimal monthlySpend,
        BigDecimal reserved,
        BigDecimal dailyCap,
        BigDecimal monthlyCap,
        Instant lastReset
) {
    public BudgetState {
        Objects.requireNonNull(dailySpend, "dailySpend");
        Objects.requireNonNull(monthlySpend, "monthlySpend");
        Objects.requireNonNull(reserved, "reserved");
        Objects.requireNonNull(dailyCap, "dailyCap");
        Objects.requireNonNull(monthlyCap, "monthlyCap");
        Objects.requireNonNull(lastReset, "lastReset");
    }

    public static BudgetState empty(BigDecimal dailyCap, BigDecimal monthlyCap, Instant now) {
        return new BudgetState(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, dailyCap, monthlyCap, now);
    }

    public BigDecimal remainingDaily() {
        return dailyCap.subtract(dailySpend).subtract(reserved).max(BigDecimal.ZERO);
    }

    public BigDecimal remainingMonthly() {
        return monthlyCap.subtract(monthlySpend).subtract(reserved).max(BigDecimal.ZERO);
    }

    /** True if a charge of {@code cost} fits under both caps, counting outstanding reservations. */
    public boolean canAfford(BigDecimal cost) {
        return cost.compareTo(remainingDaily()) <= 0 && cost.compareTo(remainingMonthly()) <= 0;
    }

    /** True once either cap has been fully spent. */
    public boolean isExhausted() {
        return dailySpend.compareTo(dailyCap) >= 0 || monthlySpend.compareTo(monthlyCap) >= 0;
    }
}
