package com.phillippitts.hazardscan.service.metrics;

import com.phillippitts.hazardscan.domain.AttemptRecord;
import com.phillippitts.hazardscan.domain.BudgetState;
import com.phillippitts.hazardscan.service.orchestration.event.AttemptFinishedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.BudgetStateChangedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.CacheEvictionEvent;
import com.phillippitts.hazardscan.service.orchestration.event.CacheLookupEvent;
import com.phillippitts.hazardscan.service.orchestration.event.SecurityVerdictEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Centralized metrics for hazard analysis, fed by pipeline events.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Attempt latency and outcome per backend tier</li>
 *   <li>Cache lookups by outcome and evictions by reason</li>
 *   <li>Security findings by kind</li>
 *   <li>Budget spend, reservations and remaining allowance (gauges)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer.
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "hazardscan";

    private final MeterRegistry registry;
    private final AtomicReference<BudgetState> lastBudget = new AtomicReference<>();

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
        budgetGauge("daily.spend", BudgetState::dailySpend);
        budgetGauge("monthly.spend", BudgetState::monthlySpend);
        budgetGauge("reserved", BudgetState::reserved);
        budgetGauge("daily.remaining", BudgetState::remainingDaily);
        budgetGauge("monthly.remaining", BudgetState::remainingMonthly);
    }

    private void budgetGauge(String name, Function<BudgetState, BigDecimal> value) {
        Gauge.builder(METRIC_PREFIX + ".budget." + name, lastBudget, ref -> {
                    BudgetState s = ref.get();
                    return s == null ? 0.0 : value.apply(s).doubleValue();
                })
                .description("Cloud budget " + name.replace('.', ' '))
                .register(registry);
    }

    /**
     * Records latency and outcome of one backend attempt.
     */
    @EventListener
    public void onAttemptFinished(AttemptFinishedEvent event) {
        AttemptRecord attempt = event.attempt();
        String tier = attempt.tier().label();
        String outcome = attempt.outcome().name().toLowerCase(Locale.ROOT);
        Timer.builder(METRIC_PREFIX + ".attempt.latency")
                .description("Time taken by one backend attempt")
                .tag("tier", tier)
                .tag("outcome", outcome)
                .register(registry)
                .record(attempt.latency());
        Counter.builder(METRIC_PREFIX + ".attempt")
                .description("Number of backend attempts by outcome")
                .tag("tier", tier)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @EventListener
    public void onCacheLookup(CacheLookupEvent event) {
        Counter.builder(METRIC_PREFIX + ".cache.lookup")
                .description("Result cache lookups by outcome")
                .tag("outcome", event.outcome().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @EventListener
    public void onCacheEviction(CacheEvictionEvent event) {
        Counter.builder(METRIC_PREFIX + ".cache.eviction")
                .description("Result cache evictions by reason")
                .tag("reason", event.reason().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @EventListener
    public void onSecurityVerdict(SecurityVerdictEvent event) {
        Counter.builder(METRIC_PREFIX + ".security.finding")
                .description("Security findings by kind")
                .tag("kind", event.finding().kind().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @EventListener
    public void onBudgetStateChanged(BudgetStateChangedEvent event) {
        lastBudget.set(event.state());
    }
}
