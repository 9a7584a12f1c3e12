package com.phillippitts.hazardscan.service.validation;

import java.util.List;

/**
 * Outcome of a validation that did not reject the request.
 *
 * @param sanitizedNotes user notes safe for prompt interpolation ("" when none were supplied)
 * @param findings non-fatal findings, in detection order
 */
public record ValidationVerdict(String sanitizedNotes, List<SecurityFinding> findings) {

    public ValidationVerdict {
        sanitizedNotes = sanitizedNotes == null ? "" : sanitizedNotes;
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
