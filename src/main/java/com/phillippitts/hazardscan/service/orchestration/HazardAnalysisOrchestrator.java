package com.phillippitts.hazardscan.service.orchestration;

import com.phillippitts.hazardscan.domain.AnalysisOutcome;
import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.CancellationToken;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the hazard analysis pipeline.
 *
 * <p>Pipeline: security validation, result cache lookup, then on a miss strategy selection and
 * the fallback chain, with budget accounting along the way. The result carries its provenance
 * chain.
 *
 * <p><b>Error Handling:</b> implementations never throw for analysis failures. Rejected input,
 * model integrity violations, exhausted chains and cancellation are all reported as
 * {@link AnalysisOutcome#failure failures}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AnalysisRequest request = requestFactory.create(jpeg, 1920, 1080, WorkType.ROOFING);
 * AnalysisOutcome outcome = orchestrator.analyze(request);
 * outcome.result().ifPresent(r -> show(r.hazards()));
 * }</pre>
 */
public interface HazardAnalysisOrchestrator {

    /**
     * Analyzes an image and blocks until the outcome is known.
     */
    AnalysisOutcome analyze(AnalysisRequest request);

    /**
     * Analyzes an image asynchronously.
     *
     * @param token cancels this request; a computation shared with other callers keeps running
     *              for them
     * @return future that always completes normally with an outcome
     */
    CompletableFuture<AnalysisOutcome> analyzeAsync(AnalysisRequest request, CancellationToken token);

    /**
     * Analyzes several images with at most {@code maxConcurrency} in flight, blocking until all
     * are done. Requests sharing a cache key are computed once.
     *
     * @return one outcome per request, in input order
     * @throws IllegalArgumentException if {@code maxConcurrency < 1}
     */
    List<AnalysisOutcome> analyzeBatch(List<AnalysisRequest> requests, int maxConcurrency);
}
