package com.phillippitts.hazardscan.service.events;

import com.phillippitts.hazardscan.domain.AttemptOutcome;
import com.phillippitts.hazardscan.service.orchestration.event.AttemptFinishedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.BudgetStateChangedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.SecurityVerdictEvent;
import com.phillippitts.hazardscan.service.validation.SecurityFinding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing warnings. Privacy-safe and throttled to avoid log spam.
 */
@Component
class AnalysisEventsListener {
    private static final Logger LOG = LogManager.getLogger(AnalysisEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSecurityVerdict(SecurityVerdictEvent e) {
        SecurityFinding finding = e.finding();
        if (finding.kind() == SecurityFinding.Kind.MODEL_INTEGRITY_VIOLATION) {
            // Rare and critical; never throttled
            LOG.error("Model integrity violation on {}: {}. Tier disabled until restart.",
                    finding.tier() == null ? "unknown tier" : finding.tier().label(), finding.detail());
            return;
        }
        if (shouldLog("security-" + finding.kind())) {
            LOG.warn("Security finding {} (request {}): {}", finding.kind(), e.requestId(), finding.detail());
        }
    }

    @EventListener
    void onBudgetStateChanged(BudgetStateChangedEvent e) {
        if (e.state().isExhausted() && shouldLog("budget-exhausted")) {
            LOG.warn("Cloud budget exhausted (daily {}/{}, monthly {}/{}). Cloud tier skipped until rollover.",
                    e.state().dailySpend().toPlainString(), e.state().dailyCap().toPlainString(),
                    e.state().monthlySpend().toPlainString(), e.state().monthlyCap().toPlainString());
        }
    }

    @EventListener
    void onAttemptFinished(AttemptFinishedEvent e) {
        if (e.attempt().outcome() == AttemptOutcome.TIMED_OUT) {
            String key = "timeout-" + e.attempt().tier();
            if (shouldLog(key)) {
                LOG.warn("Backend {} timing out (latest after {} ms). Check device load or network.",
                        e.attempt().tier().label(), e.attempt().latency().toMillis());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
