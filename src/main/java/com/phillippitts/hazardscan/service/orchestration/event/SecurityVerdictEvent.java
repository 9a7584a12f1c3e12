package com.phillippitts.hazardscan.service.orchestration.event;

import com.phillippitts.hazardscan.service.validation.SecurityFinding;

import java.time.Instant;

/**
 * Published for every security finding, fatal or not.
 *
 * <p>PII note: the finding detail never contains user notes or image bytes.
 */
public record SecurityVerdictEvent(long requestId, SecurityFinding finding, Instant at) {
    public SecurityVerdictEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
