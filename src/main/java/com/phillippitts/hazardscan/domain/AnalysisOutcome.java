package com.phillippitts.hazardscan.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Either an {@link AnalysisResult} or an {@link AnalysisError}; never both.
 */
public final class AnalysisOutcome {

    private final AnalysisResult result;
    private final AnalysisError error;

    private AnalysisOutcome(AnalysisResult result, AnalysisError error) {
        this.result = result;
        this.error = error;
    }

    public static AnalysisOutcome success(AnalysisResult result) {
        return new AnalysisOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static AnalysisOutcome failure(AnalysisError error) {
        return new AnalysisOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<AnalysisResult> result() {
        return Optional.ofNullable(result);
    }

    public Optional<AnalysisError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the result or throws {@link IllegalStateException} describing the error.
     */
    public AnalysisResult orElseThrow() {
        if (result == null) {
            throw new IllegalStateException("Analysis failed: " + error.type() + " - " + error.message(), error.cause());
        }
        return result;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "AnalysisOutcome[success, tier=" + result.sourceTier() + "]"
                : "AnalysisOutcome[failure, type=" + error.type() + "]";
    }
}
