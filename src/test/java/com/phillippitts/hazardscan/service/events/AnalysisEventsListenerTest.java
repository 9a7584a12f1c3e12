package com.phillippitts.hazardscan.service.events;

import com.phillippitts.hazardscan.domain.AttemptOutcome;
import com.phillippitts.hazardscan.domain.AttemptRecord;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.domain.BudgetState;
import com.phillippitts.hazardscan.service.orchestration.event.AttemptFinishedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.BudgetStateChangedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.SecurityVerdictEvent;
import com.phillippitts.hazardscan.service.validation.SecurityFinding;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class AnalysisEventsListenerTest {

    @Test
    void throttlesRepeatedKeys() {
        AnalysisEventsListener listener = new AnalysisEventsListener();

        assertThat(listener.shouldLog("timeout-CLOUD")).isTrue();
        assertThat(listener.shouldLog("timeout-CLOUD")).isFalse();
        assertThat(listener.shouldLog("timeout-LOCAL_LARGE")).isTrue();
    }

    @Test
    void handlesEventsWithoutThrowing() {
        AnalysisEventsListener listener = new AnalysisEventsListener();
        BudgetState exhausted = new BudgetState(new BigDecimal("5.00"), new BigDecimal("5.00"), BigDecimal.ZERO,
                new BigDecimal("5.00"), new BigDecimal("100.00"), Instant.EPOCH);
        AttemptRecord timeout = new AttemptRecord(0, BackendTier.CLOUD, AttemptOutcome.TIMED_OUT,
                Duration.ofSeconds(10), 0.0, BigDecimal.ZERO, "timed out");

        assertThatCode(() -> {
            listener.onSecurityVerdict(new SecurityVerdictEvent(1,
                    SecurityFinding.of(SecurityFinding.Kind.OVERSIZED_INPUT, "too big"), null));
            listener.onSecurityVerdict(new SecurityVerdictEvent(2, new SecurityFinding(
                    SecurityFinding.Kind.MODEL_INTEGRITY_VIOLATION, "digest mismatch", BackendTier.LOCAL_LARGE), null));
            listener.onBudgetStateChanged(new BudgetStateChangedEvent(exhausted, "commit", null));
            listener.onAttemptFinished(new AttemptFinishedEvent(3, timeout, null));
        }).doesNotThrowAnyException();

        // The handlers above consumed their throttle slots
        assertThat(listener.shouldLog("budget-exhausted")).isFalse();
        assertThat(listener.shouldLog("timeout-CLOUD")).isFalse();
    }
}
