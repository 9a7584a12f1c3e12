package com.phillippitts.hazardscan.service.health;

import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.domain.BudgetState;
import com.phillippitts.hazardscan.service.backend.BackendRegistry;
import com.phillippitts.hazardscan.service.backend.InferenceBackend;
import com.phillippitts.hazardscan.service.budget.BudgetManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the inference backends.
 *
 * <p>Reports per-tier availability for monitoring and alerting:
 * <ul>
 *   <li>UP: every registered backend ready</li>
 *   <li>DEGRADED: at least one backend ready</li>
 *   <li>DOWN: no backend ready</li>
 * </ul>
 * Tiers disabled by a model integrity violation are reported with their reason.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final BackendRegistry registry;
    private final BudgetManager budget;

    public BackendHealthIndicator(BackendRegistry registry, BudgetManager budget) {
        this.registry = registry;
        this.budget = budget;
    }

    @Override
    public Health health() {
        Map<String, String> tiers = new TreeMap<>();
        int ready = 0;
        int total = 0;
        for (InferenceBackend backend : registry.all()) {
            total++;
            String status = tierStatus(backend);
            if ("ready".equals(status)) {
                ready++;
            }
            tiers.put(backend.tier().label(), status);
        }

        Health.Builder builder = new Health.Builder();
        if (total > 0 && ready == total) {
            builder.up().withDetail("status", "All backends operational");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial backend availability");
        } else {
            builder.down().withDetail("status", "No backends available");
        }

        BudgetState state = budget.currentState();
        return builder.withDetail("backends", tiers)
                .withDetail("budgetRemainingDaily", state.remainingDaily().toPlainString())
                .withDetail("budgetRemainingMonthly", state.remainingMonthly().toPlainString())
                .build();
    }

    private String tierStatus(InferenceBackend backend) {
        BackendTier tier = backend.tier();
        if (registry.isDisabled(tier)) {
            return "disabled: " + registry.disabledReason(tier).orElse("unknown");
        }
        return backend.isHealthy() ? "ready" : "unhealthy";
    }
}
