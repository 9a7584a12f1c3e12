package com.phillippitts.hazardscan.service.orchestration;

import com.phillippitts.hazardscan.domain.AnalysisError;
import com.phillippitts.hazardscan.domain.AnalysisErrorType;
import com.phillippitts.hazardscan.domain.AnalysisOutcome;
import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.AnalysisResult;
import com.phillippitts.hazardscan.domain.AttemptRecord;
import com.phillippitts.hazardscan.domain.BudgetState;
import com.phillippitts.hazardscan.domain.CancellationToken;
import com.phillippitts.hazardscan.domain.DeviceState;
import com.phillippitts.hazardscan.exception.AllBackendsFailedException;
import com.phillippitts.hazardscan.exception.InputRejectedException;
import com.phillippitts.hazardscan.exception.ModelIntegrityViolationException;
import com.phillippitts.hazardscan.service.backend.InferenceBackend;
import com.phillippitts.hazardscan.service.budget.BudgetManager;
import com.phillippitts.hazardscan.service.cache.CacheOutcome;
import com.phillippitts.hazardscan.service.cache.ResultCache;
import com.phillippitts.hazardscan.service.device.DeviceCapabilityProfiler;
import com.phillippitts.hazardscan.service.fallback.FallbackCoordinator;
import com.phillippitts.hazardscan.service.strategy.StrategySelector;
import com.phillippitts.hazardscan.service.validation.SecurityValidator;
import com.phillippitts.hazardscan.service.validation.ValidationVerdict;
import com.phillippitts.hazardscan.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Default {@link HazardAnalysisOrchestrator}.
 *
 * <p>Validation runs synchronously on the caller's thread. The cache computation (device
 * sampling, strategy selection, fallback chain) runs on the cache's executor, so a caller that
 * cancels can return at once while a computation shared with other callers continues.
 *
 * <p>The request id is placed in the Log4j2 {@link ThreadContext} under {@value #MDC_REQUEST_ID}
 * for the duration of the call; executors propagate it to worker threads.
 *
 * <p>This is the only place where exceptions become {@link AnalysisOutcome} failures.
 */
public class DefaultHazardAnalysisOrchestrator implements HazardAnalysisOrchestrator {
    private static final Logger LOG = LogManager.getLogger(DefaultHazardAnalysisOrchestrator.class);

    static final String MDC_REQUEST_ID = "requestId";

    private final SecurityValidator validator;
    private final ResultCache cache;
    private final DeviceCapabilityProfiler deviceProfiler;
    private final BudgetManager budget;
    private final StrategySelector selector;
    private final FallbackCoordinator coordinator;

    public DefaultHazardAnalysisOrchestrator(SecurityValidator validator,
                                             ResultCache cache,
                                             DeviceCapabilityProfiler deviceProfiler,
                                             BudgetManager budget,
                                             StrategySelector selector,
                                             FallbackCoordinator coordinator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.deviceProfiler = Objects.requireNonNull(deviceProfiler, "deviceProfiler must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
    }

    @Override
    public AnalysisOutcome analyze(AnalysisRequest request) {
        CancellationToken token = CancellationToken.create();
        return await(request, analyzeAsync(request, token), token);
    }

    @Override
    public List<AnalysisOutcome> analyzeBatch(List<AnalysisRequest> requests, int maxConcurrency) {
        Objects.requireNonNull(requests, "requests");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got: " + maxConcurrency);
        }
        LOG.info("Analyzing batch of {} image(s), maxConcurrency={}", requests.size(), maxConcurrency);
        Semaphore permits = new Semaphore(maxConcurrency);
        CancellationToken token = CancellationToken.create();
        List<CompletableFuture<AnalysisOutcome>> futures = new ArrayList<>(requests.size());
        for (AnalysisRequest request : requests) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel();
                futures.add(CompletableFuture.completedFuture(
                        failure(AnalysisErrorType.CANCELLED, "Batch interrupted", List.of(), e)));
                continue;
            }
            futures.add(analyzeAsync(request, token).whenComplete((outcome, error) -> permits.release()));
        }

        List<AnalysisOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(requests.get(i), futures.get(i), token));
        }
        return outcomes;
    }

    private AnalysisOutcome await(AnalysisRequest request, CompletableFuture<AnalysisOutcome> future,
                                  CancellationToken token) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return failure(AnalysisErrorType.CANCELLED, "Interrupted while waiting for analysis", List.of(), e);
        } catch (ExecutionException e) {
            // analyzeAsync maps every failure to an outcome
            return toFailure(request, e.getCause());
        }
    }

    @Override
    public CompletableFuture<AnalysisOutcome> analyzeAsync(AnalysisRequest request, CancellationToken token) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(token, "token");
        String previous = ThreadContext.get(MDC_REQUEST_ID);
        ThreadContext.put(MDC_REQUEST_ID, String.valueOf(request.requestId()));
        try {
            LOG.debug("Analyzing {}", request);
            ValidationVerdict verdict = validator.validate(request);
            AnalysisRequest sanitized = request.withUserNotes(verdict.sanitizedNotes());
            return cache.getOrComputeAsync(request.cacheKey(), shared -> compute(sanitized, shared), token)
                    .handle((result, error) -> {
                        if (error != null) {
                            return toFailure(request, error);
                        }
                        LOG.info("Request {} analyzed by {} (confidence={}, hazards={}, degraded={})",
                                request.requestId(), result.sourceTier().label(),
                                String.format(Locale.ROOT, "%.2f", result.overallConfidence()),
                                result.hazards().size(), result.degraded());
                        return AnalysisOutcome.success(result);
                    });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(toFailure(request, e));
        } finally {
            if (previous != null) {
                ThreadContext.put(MDC_REQUEST_ID, previous);
            } else {
                ThreadContext.remove(MDC_REQUEST_ID);
            }
        }
    }

    /**
     * Cache miss path: sample the device, read the budget, plan and run the chain.
     */
    private AnalysisResult compute(AnalysisRequest request, CancellationToken shared) {
        DeviceState device = deviceProfiler.currentState();
        BudgetState budgetState = budget.currentState();
        List<InferenceBackend> order = selector.selectOrder(request, device, budgetState, CacheOutcome.MISS);
        if (order.isEmpty()) {
            LOG.error("No backend available for request {} ({})", request.requestId(),
                    LogSanitizer.shortFingerprint(request.fingerprint()));
            throw new AllBackendsFailedException(List.of());
        }
        return coordinator.run(order, request, shared);
    }

    private AnalysisOutcome toFailure(AnalysisRequest request, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof InputRejectedException e) {
            return failure(AnalysisErrorType.INPUT_REJECTED, e.getMessage(), List.of(), e);
        }
        if (cause instanceof ModelIntegrityViolationException e) {
            return failure(AnalysisErrorType.MODEL_INTEGRITY_VIOLATION, e.getMessage(), List.of(), e);
        }
        if (cause instanceof AllBackendsFailedException e) {
            return failure(AnalysisErrorType.ALL_BACKENDS_FAILED, e.getMessage(), e.getProvenance(), e);
        }
        if (cause instanceof RejectedExecutionException) {
            LOG.warn("Request {} rejected: orchestration pool saturated", request.requestId());
            return failure(AnalysisErrorType.OVERLOADED, "Analysis capacity exhausted; retry later", List.of(), cause);
        }
        if (cause instanceof CancellationException) {
            LOG.info("Request {} cancelled", request.requestId());
            return failure(AnalysisErrorType.CANCELLED, "Analysis cancelled", List.of(), cause);
        }
        LOG.error("Unexpected failure analyzing request {}", request.requestId(), cause);
        return failure(AnalysisErrorType.INTERNAL, String.valueOf(cause.getMessage()), List.of(), cause);
    }

    private static AnalysisOutcome failure(AnalysisErrorType type, String message,
                                           List<AttemptRecord> provenance,
                                           Throwable cause) {
        return AnalysisOutcome.failure(new AnalysisError(type, message, provenance, cause));
    }
}
