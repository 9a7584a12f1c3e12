package com.phillippitts.hazardscan.exception;

/**
 * Thrown when an image payload exceeds the configured byte ceiling (denial-of-service guard).
 */
public class OversizedInputException extends InputRejectedException {

    private final long limitBytes;

    public OversizedInputException(int inputSize, long limitBytes) {
        super(inputSize, "payload too large, max " + limitBytes + " bytes ("
                + (limitBytes / (1024 * 1024)) + " MB)");
        this.limitBytes = limitBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
