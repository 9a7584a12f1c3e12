package com.phillippitts.hazardscan.exception;

import com.phillippitts.hazardscan.domain.AttemptRecord;

import java.util.List;

/**
 * Fatal: every attempt failed or timed out and no low-confidence candidate exists.
 */
public class AllBackendsFailedException extends HazardScanException {

    private final transient List<AttemptRecord> provenance;

    public AllBackendsFailedException(List<AttemptRecord> provenance) {
        super("All backends failed after " + provenance.size() + " attempt(s)");
        this.provenance = List.copyOf(provenance);
    }

    public List<AttemptRecord> getProvenance() {
        return provenance;
    }
}
