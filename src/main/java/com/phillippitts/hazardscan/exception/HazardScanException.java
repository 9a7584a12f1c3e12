package com.phillippitts.hazardscan.exception;

/**
 * Base exception for all HazardScan application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class HazardScanException extends RuntimeException {

    public HazardScanException(String message) {
        super(message);
    }

    public HazardScanException(String message, Throwable cause) {
        super(message, cause);
    }

    public HazardScanException(Throwable cause) {
        super(cause);
    }
}
