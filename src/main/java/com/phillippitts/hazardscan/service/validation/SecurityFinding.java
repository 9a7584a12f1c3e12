package com.phillippitts.hazardscan.service.validation;

import com.phillippitts.hazardscan.domain.BackendTier;

import java.util.Objects;

/**
 * A security observation made while validating a request.
 *
 * <p>Rejections are also thrown as exceptions; {@link Kind#PROMPT_INJECTION_ATTEMPT} is only
 * recorded, and processing continues with the sanitized text.
 *
 * @param kind what was observed
 * @param detail technical description; never contains user text
 * @param tier backend tier concerned, or {@code null} when the finding is about the input
 */
public record SecurityFinding(Kind kind, String detail, BackendTier tier) {

    public enum Kind {
        OVERSIZED_INPUT,
        MALFORMED_INPUT,
        ADVERSARIAL_PATTERN,
        MODEL_INTEGRITY_VIOLATION,
        PROMPT_INJECTION_ATTEMPT;

        public boolean isRejection() {
            return this != PROMPT_INJECTION_ATTEMPT;
        }
    }

    public SecurityFinding {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }

    public static SecurityFinding of(Kind kind, String detail) {
        return new SecurityFinding(kind, detail, null);
    }
}
