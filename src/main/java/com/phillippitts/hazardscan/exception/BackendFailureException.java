package com.phillippitts.hazardscan.exception;

import com.phillippitts.hazardscan.domain.BackendTier;

/** Backend returned an error, crashed, or was unavailable. */
public class BackendFailureException extends BackendException {

    public BackendFailureException(String message, BackendTier tier) {
        super(message, tier);
    }

    public BackendFailureException(String message, BackendTier tier, Throwable cause) {
        super(message, tier, cause);
    }
}
