package com.phillippitts.hazardscan.domain;

import java.util.List;
import java.util.Objects;

/**
 * Terminal failure reported to the caller.
 *
 * @param type failure category
 * @param message human-readable description (no user content)
 * @param provenance attempts made before failing; empty for security rejections
 * @param cause underlying exception, may be null
 */
public record AnalysisError(
        AnalysisErrorType type,
        String message,
        List<AttemptRecord> provenance,
        Throwable cause
) {
    public AnalysisError {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
    }
}
