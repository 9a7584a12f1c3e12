package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.exception.BackendException;

import java.util.Optional;

/**
 * An opaque hazard-detection capability with a declared contract.
 *
 * <p>Implementations must be thread-safe and must react to thread interruption: the fallback
 * coordinator interrupts the calling thread when the tier timeout expires or the request is
 * cancelled.
 */
public interface InferenceBackend extends AutoCloseable {

    /** Declared latency, accuracy, cost and resource contract. */
    BackendDescriptor descriptor();

    default BackendTier tier() {
        return descriptor().tier();
    }

    /**
     * Analyzes one image.
     *
     * @param request validated request; user notes are already sanitized
     * @return the backend's answer, confidence not yet judged
     * @throws BackendException if the backend fails or is not ready
     */
    BackendResponse analyze(AnalysisRequest request);

    void initialize();

    boolean isHealthy();

    /** Model file to verify before first use, if this backend loads one. */
    default Optional<ModelArtifact> modelArtifact() {
        return Optional.empty();
    }

    @Override
    void close();
}
