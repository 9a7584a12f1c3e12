package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.exception.BackendExceptionBuilder;

/**
 * Installed when the host provides no on-device runtime. Every call fails so the chain falls
 * through to the next tier.
 */
public class UnavailableLocalModelRunner implements LocalModelRunner {

    @Override
    public BackendResponse run(BackendTier tier, ModelArtifact artifact, AnalysisRequest request) {
        throw BackendExceptionBuilder.create("No on-device inference runtime installed")
                .tier(tier)
                .build();
    }
}
