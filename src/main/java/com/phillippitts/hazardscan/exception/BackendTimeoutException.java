package com.phillippitts.hazardscan.exception;

import com.phillippitts.hazardscan.domain.BackendTier;

import java.time.Duration;

/**
 * A backend gave up on its own deadline, e.g. the cloud HTTP request timed out. Recorded as a
 * TIMED_OUT attempt, exactly like a coordinator-side timeout.
 */
public class BackendTimeoutException extends BackendException {

    private final Duration timeout;

    public BackendTimeoutException(BackendTier tier, Duration timeout, Throwable cause) {
        super("Timed out after " + timeout.toMillis() + "ms", tier, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
