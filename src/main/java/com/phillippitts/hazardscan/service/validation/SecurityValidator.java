package com.phillippitts.hazardscan.service.validation;

import com.phillippitts.hazardscan.config.properties.ValidationProperties;
import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.exception.InputRejectedException;
import com.phillippitts.hazardscan.exception.MalformedInputException;
import com.phillippitts.hazardscan.exception.ModelIntegrityViolationException;
import com.phillippitts.hazardscan.exception.OversizedInputException;
import com.phillippitts.hazardscan.service.backend.BackendRegistry;
import com.phillippitts.hazardscan.service.backend.InferenceBackend;
import com.phillippitts.hazardscan.service.orchestration.event.SecurityVerdictEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * First stage of the pipeline: rejects unsafe input before any backend is considered.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>payload size ceiling</li>
 *   <li>declared dimensions within bounds</li>
 *   <li>encoding structure ({@link ImageFormatInspector})</li>
 *   <li>adversarial byte-histogram heuristic, when enabled</li>
 *   <li>integrity of each not-yet-verified local model</li>
 *   <li>prompt sanitization of user notes</li>
 * </ol>
 *
 * <p>Rejections are thrown and never retried or cached. A model integrity violation disables
 * the affected tier in the {@link BackendRegistry} before it is rethrown, so later requests run
 * without that tier. Prompt injection attempts are reported but do not stop processing.
 */
public class SecurityValidator {
    private static final Logger LOG = LogManager.getLogger(SecurityValidator.class);

    private final ValidationProperties props;
    private final ImageFormatInspector inspector;
    private final PromptSanitizer sanitizer;
    private final ModelIntegrityVerifier integrityVerifier;
    private final BackendRegistry registry;
    private final ApplicationEventPublisher publisher;

    public SecurityValidator(ValidationProperties props,
                             ImageFormatInspector inspector,
                             PromptSanitizer sanitizer,
                             ModelIntegrityVerifier integrityVerifier,
                             BackendRegistry registry,
                             ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.integrityVerifier = Objects.requireNonNull(integrityVerifier, "integrityVerifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.publisher = publisher;
    }

    /**
     * Validates a request.
     *
     * @return verdict carrying the sanitized notes and any non-fatal findings
     * @throws InputRejectedException if the image is oversized or malformed
     * @throws ModelIntegrityViolationException if a local model fails its digest check
     */
    public ValidationVerdict validate(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        try {
            validateImage(request);
        } catch (InputRejectedException e) {
            SecurityFinding.Kind kind = e instanceof OversizedInputException
                    ? SecurityFinding.Kind.OVERSIZED_INPUT
                    : SecurityFinding.Kind.MALFORMED_INPUT;
            throw reject(request, kind, e);
        }
        if (props.isAdversarialDetectionEnabled()) {
            try {
                checkAdversarialPattern(request.imageBytes());
            } catch (InputRejectedException e) {
                throw reject(request, SecurityFinding.Kind.ADVERSARIAL_PATTERN, e);
            }
        }

        verifyModels(request.requestId());

        List<SecurityFinding> findings = new ArrayList<>();
        PromptSanitizer.Sanitized notes = sanitizer.sanitize(request.userNotes());
        if (notes.injectionDetected()) {
            SecurityFinding finding = SecurityFinding.of(SecurityFinding.Kind.PROMPT_INJECTION_ATTEMPT,
                    "neutralized " + notes.matchedPatterns().size() + " injection pattern(s)");
            findings.add(finding);
            report(request.requestId(), finding);
            LOG.warn("Prompt injection attempt neutralized in request {} (patterns={})",
                    request.requestId(), notes.matchedPatterns());
        }
        return new ValidationVerdict(notes.text(), findings);
    }

    private void validateImage(AnalysisRequest request) {
        int size = request.byteSize();
        if (size > props.getMaxImageBytes()) {
            throw new OversizedInputException(size, props.getMaxImageBytes());
        }
        if (size == 0) {
            throw new MalformedInputException(size, "image is empty");
        }
        int w = request.width();
        int h = request.height();
        if (w < props.getMinDimension() || h < props.getMinDimension()
                || w > props.getMaxDimension() || h > props.getMaxDimension()) {
            throw new MalformedInputException(size, "dimensions " + w + "x" + h + " outside ["
                    + props.getMinDimension() + ", " + props.getMaxDimension() + "]");
        }
        inspector.inspect(request.imageBytes(), w, h);
    }

    private InputRejectedException reject(AnalysisRequest request, SecurityFinding.Kind kind,
                                          InputRejectedException e) {
        report(request.requestId(), SecurityFinding.of(kind, e.getReason()));
        LOG.warn("Rejected request {}: {}", request.requestId(), e.getMessage());
        return e;
    }

    /**
     * Rejects payloads whose most frequent byte value exceeds the configured share of all bytes.
     */
    private void checkAdversarialPattern(byte[] data) {
        int[] histogram = new int[256];
        for (byte b : data) {
            histogram[b & 0xFF]++;
        }
        int max = 0;
        for (int count : histogram) {
            max = Math.max(max, count);
        }
        double share = (double) max / data.length;
        if (share > props.getAdversarialConcentrationThreshold()) {
            throw new MalformedInputException(data.length,
                    String.format(Locale.ROOT, "adversarial pattern suspected (byte concentration %.2f)", share));
        }
    }

    private void verifyModels(long requestId) {
        for (InferenceBackend backend : registry.enabled()) {
            if (!backend.tier().isLocal() || backend.modelArtifact().isEmpty()) {
                continue;
            }
            try {
                integrityVerifier.verifyOnce(backend.tier(), backend.modelArtifact().get());
            } catch (ModelIntegrityViolationException e) {
                registry.disable(backend.tier(), "model integrity violation");
                report(requestId, new SecurityFinding(SecurityFinding.Kind.MODEL_INTEGRITY_VIOLATION,
                        e.getMessage(), backend.tier()));
                throw e;
            }
        }
    }

    private void report(long requestId, SecurityFinding finding) {
        if (publisher != null) {
            publisher.publishEvent(new SecurityVerdictEvent(requestId, finding, null));
        }
    }
}
