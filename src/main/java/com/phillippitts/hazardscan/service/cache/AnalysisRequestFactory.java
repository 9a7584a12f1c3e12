package com.phillippitts.hazardscan.service.cache;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.WorkType;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds {@link AnalysisRequest}s from captured images, assigning monotonic ids and fingerprints.
 */
public class AnalysisRequestFactory {

    private final ImageFingerprinter fingerprinter;
    private final AtomicLong nextId = new AtomicLong(1);

    public AnalysisRequestFactory(ImageFingerprinter fingerprinter) {
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
    }

    public AnalysisRequest create(byte[] image, int width, int height, WorkType workType) {
        return create(image, width, height, workType, null);
    }

    public AnalysisRequest create(byte[] image, int width, int height, WorkType workType, String userNotes) {
        Objects.requireNonNull(image, "image");
        String fingerprint = fingerprinter.fingerprint(image, width, height);
        return new AnalysisRequest(nextId.getAndIncrement(), image, width, height, workType, fingerprint, userNotes);
    }
}
