package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.exception.BackendExceptionBuilder;
import com.phillippitts.hazardscan.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Cloud vision backend.
 *
 * <p>The API key is fetched from the {@link CredentialProvider} for each call and dropped
 * afterwards. Concurrent requests are capped by a {@link ConcurrencyGuard}. The prompt is
 * rendered from a template where {@code {workType}} and {@code {notes}} are replaced; notes
 * arrive already sanitized by the security validator.
 */
public class CloudBackend extends AbstractInferenceBackend {
    private static final Logger LOG = LogManager.getLogger(CloudBackend.class);

    private final CloudVisionClient client;
    private final CredentialProvider credentials;
    private final ConcurrencyGuard guard;
    private final String promptTemplate;

    public CloudBackend(BackendDescriptor descriptor,
                        CloudVisionClient client,
                        CredentialProvider credentials,
                        ConcurrencyGuard guard,
                        String promptTemplate) {
        super(descriptor);
        if (descriptor.tier() != BackendTier.CLOUD) {
            throw new IllegalArgumentException("CloudBackend requires the CLOUD tier, got: " + descriptor.tier());
        }
        this.client = Objects.requireNonNull(client, "client");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.promptTemplate = Objects.requireNonNull(promptTemplate, "promptTemplate");
    }

    @Override
    protected BackendResponse doAnalyze(AnalysisRequest request) throws Exception {
        String apiKey = credentials.currentApiKey()
                .orElseThrow(() -> BackendExceptionBuilder.create("No cloud credential configured")
                        .tier(BackendTier.CLOUD)
                        .build());
        String prompt = renderPrompt(request);
        LOG.debug("Cloud analysis: fingerprint={}, notes={}",
                LogSanitizer.shortFingerprint(request.fingerprint()),
                LogSanitizer.describeLength(request.userNotes()));

        guard.acquire(BackendTier.CLOUD);
        try {
            return client.analyze(request.imageBytes(), prompt, apiKey);
        } finally {
            guard.release();
        }
    }

    String renderPrompt(AnalysisRequest request) {
        String notes = request.userNotes() == null || request.userNotes().isBlank()
                ? "none"
                : request.userNotes();
        return promptTemplate
                .replace("{workType}", request.workType().name().toLowerCase(Locale.ROOT).replace('_', ' '))
                .replace("{notes}", notes);
    }
}
