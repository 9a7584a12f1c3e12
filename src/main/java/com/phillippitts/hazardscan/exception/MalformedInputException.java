package com.phillippitts.hazardscan.exception;

/**
 * Thrown when image bytes do not form a supported, well-formed encoding or contradict the
 * declared dimensions.
 */
public class MalformedInputException extends InputRejectedException {

    public MalformedInputException(int inputSize, String reason) {
        super(inputSize, reason);
    }
}
