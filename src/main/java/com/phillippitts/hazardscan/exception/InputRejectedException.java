package com.phillippitts.hazardscan.exception;

/**
 * Thrown when security validation refuses an image. Never retried and never cached.
 */
public class InputRejectedException extends HazardScanException {

    private final int inputSize;
    private final String reason;

    public InputRejectedException(int inputSize, String reason) {
        super("Image rejected (" + inputSize + " bytes): " + reason);
        this.inputSize = inputSize;
        this.reason = reason;
    }

    public int getInputSize() {
        return inputSize;
    }

    public String getReason() {
        return reason;
    }
}
