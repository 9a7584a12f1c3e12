package com.phillippitts.hazardscan.service.health;

import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.service.backend.BackendRegistry;
import com.phillippitts.hazardscan.service.budget.BudgetManager;
import com.phillippitts.hazardscan.service.budget.InMemoryBudgetStore;
import com.phillippitts.hazardscan.testutil.FakeBackend;
import com.phillippitts.hazardscan.testutil.MutableClock;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BackendHealthIndicatorTest {

    private final BudgetManager budget = new BudgetManager(new BigDecimal("5.00"), new BigDecimal("100.00"),
            ZoneOffset.UTC, MutableClock.at("2026-03-10T08:00:00Z"), new InMemoryBudgetStore(), null);

    @Test
    void shouldReportUpWhenAllBackendsReady() {
        BackendRegistry registry = new BackendRegistry(List.of(FakeBackend.localSmall(), FakeBackend.emergency()));

        Health health = new BackendHealthIndicator(registry, budget).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "All backends operational");
        assertThat(health.getDetails()).containsEntry("budgetRemainingDaily", "5.00");
    }

    @Test
    void shouldReportDegradedWithDisabledReason() {
        BackendRegistry registry = new BackendRegistry(List.of(FakeBackend.localLarge(), FakeBackend.emergency()));
        registry.disable(BackendTier.LOCAL_LARGE, "model integrity violation");

        Health health = new BackendHealthIndicator(registry, budget).health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        Map<String, Object> details = health.getDetails();
        assertThat(details.get("backends")).asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
                .containsEntry("local-large", "disabled: model integrity violation")
                .containsEntry("emergency", "ready");
    }

    @Test
    void shouldReportDownWhenNothingIsReady() {
        BackendRegistry registry = new BackendRegistry(List.of(FakeBackend.emergency().unhealthy()));

        Health health = new BackendHealthIndicator(registry, budget).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
