package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * On-device detector of a given tier.
 *
 * <p>Inference is delegated to a {@link LocalModelRunner}. Every call holds the shared
 * accelerator guard for its duration, so at most the configured number of local inferences run
 * at once across all local tiers.
 */
public class LocalBackend extends AbstractInferenceBackend {
    private static final Logger LOG = LogManager.getLogger(LocalBackend.class);

    private final LocalModelRunner runner;
    private final ConcurrencyGuard acceleratorGuard;
    private final ModelArtifact artifact;

    /**
     * @param artifact model file to verify before first use, or {@code null} if none
     */
    public LocalBackend(BackendDescriptor descriptor,
                        LocalModelRunner runner,
                        ConcurrencyGuard acceleratorGuard,
                        ModelArtifact artifact) {
        super(descriptor);
        if (!descriptor.tier().isLocal()) {
            throw new IllegalArgumentException("LocalBackend requires a local tier, got: " + descriptor.tier());
        }
        this.runner = Objects.requireNonNull(runner, "runner");
        this.acceleratorGuard = Objects.requireNonNull(acceleratorGuard, "acceleratorGuard");
        this.artifact = artifact;
    }

    @Override
    public Optional<ModelArtifact> modelArtifact() {
        return Optional.ofNullable(artifact);
    }

    @Override
    protected BackendResponse doAnalyze(AnalysisRequest request) throws Exception {
        acceleratorGuard.acquire(tier());
        try {
            LOG.debug("Running {} model on {}x{} image", tier().label(), request.width(), request.height());
            return runner.run(tier(), artifact, request);
        } finally {
            acceleratorGuard.release();
        }
    }
}
