package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendTier;

/**
 * Platform hook that executes an on-device detector.
 *
 * <p>Implementations should check {@link Thread#isInterrupted()} between inference stages and
 * abort promptly when interrupted.
 */
@FunctionalInterface
public interface LocalModelRunner {

    /**
     * @param tier which local model to run
     * @param artifact model file, or {@code null} when the tier has no configured artifact
     * @param request validated request
     * @throws Exception on any runtime failure
     */
    BackendResponse run(BackendTier tier, ModelArtifact artifact, AnalysisRequest request) throws Exception;
}
