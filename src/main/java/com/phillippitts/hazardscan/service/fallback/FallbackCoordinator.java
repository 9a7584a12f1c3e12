package com.phillippitts.hazardscan.service.fallback;

import com.phillippitts.hazardscan.config.properties.FallbackProperties;
import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.AnalysisResult;
import com.phillippitts.hazardscan.domain.AttemptOutcome;
import com.phillippitts.hazardscan.domain.AttemptRecord;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.CancellationToken;
import com.phillippitts.hazardscan.exception.AllBackendsFailedException;
import com.phillippitts.hazardscan.exception.BackendTimeoutException;
import com.phillippitts.hazardscan.exception.BudgetExceededException;
import com.phillippitts.hazardscan.service.backend.BackendResponse;
import com.phillippitts.hazardscan.service.backend.InferenceBackend;
import com.phillippitts.hazardscan.service.budget.BudgetManager;
import com.phillippitts.hazardscan.service.budget.Reservation;
import com.phillippitts.hazardscan.service.orchestration.event.AttemptFinishedEvent;
import com.phillippitts.hazardscan.service.orchestration.event.AttemptStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives an ordered backend chain until a result is accepted.
 *
 * <p>Each attempt runs on the inference executor and moves from pending to running to one of
 * ACCEPTED, LOW_CONFIDENCE, FAILED, TIMED_OUT or CANCELLED:
 * <ul>
 *   <li>ACCEPTED when the overall confidence reaches the work type's threshold; the chain stops</li>
 *   <li>LOW_CONFIDENCE otherwise; the chain continues and the response is kept as a candidate</li>
 *   <li>TIMED_OUT when the tier's max latency elapses; the task is interrupted</li>
 *   <li>CANCELLED when the caller's token fires; the task is interrupted and the chain stops</li>
 * </ul>
 *
 * <p>When the chain is exhausted, the best LOW_CONFIDENCE candidate is returned flagged as
 * degraded. With no candidate at all, {@link AllBackendsFailedException} carries the full
 * provenance.
 *
 * <p><b>Budget:</b> billable tiers reserve their declared cost before the call. A completed call
 * (accepted or low confidence) commits the metered cost; failure, timeout and cancellation
 * release the hold. A denied reservation skips the tier without an attempt record.
 *
 * <p><b>Thread Model:</b> attempts are strictly sequential, so provenance order equals
 * execution order.
 */
public class FallbackCoordinator {
    private static final Logger LOG = LogManager.getLogger(FallbackCoordinator.class);

    private final ExecutorService inferenceExecutor;
    private final BudgetManager budget;
    private final FallbackProperties props;
    private final ApplicationEventPublisher publisher;

    public FallbackCoordinator(ExecutorService inferenceExecutor,
                               BudgetManager budget,
                               FallbackProperties props,
                               ApplicationEventPublisher publisher) {
        this.inferenceExecutor = Objects.requireNonNull(inferenceExecutor, "inferenceExecutor");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = publisher;
    }

    public AnalysisResult run(List<InferenceBackend> order, AnalysisRequest request) {
        return run(order, request, CancellationToken.create());
    }

    /**
     * Runs the chain.
     *
     * @return accepted result, or the best low-confidence result flagged as degraded
     * @throws AllBackendsFailedException if no backend produced any result
     * @throws CancellationException if {@code token} was cancelled
     */
    public AnalysisResult run(List<InferenceBackend> order, AnalysisRequest request, CancellationToken token) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(token, "token");

        double threshold = props.thresholdFor(request.workType());
        List<AttemptRecord> provenance = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;
        Candidate best = null;
        long chainStart = System.nanoTime();

        for (InferenceBackend backend : order) {
            if (token.isCancelled()) {
                throw new CancellationException("Request " + request.requestId() + " cancelled");
            }
            BackendDescriptor descriptor = backend.descriptor();

            Reservation reservation = null;
            if (descriptor.isBillable()) {
                try {
                    reservation = budget.checkAndReserve(descriptor.costPerCall());
                } catch (BudgetExceededException e) {
                    LOG.info("Skipping {}: {}", descriptor.tier().label(), e.getMessage());
                    continue;
                }
            }

            int index = provenance.size();
            publish(new AttemptStartedEvent(request.requestId(), index, descriptor.tier(), null));
            Attempt attempt = execute(backend, request, token);

            AttemptOutcome outcome;
            BigDecimal charged = BigDecimal.ZERO;
            double confidence = 0.0;
            if (attempt.response() != null) {
                confidence = attempt.response().confidence();
                outcome = confidence >= threshold ? AttemptOutcome.ACCEPTED : AttemptOutcome.LOW_CONFIDENCE;
                if (reservation != null) {
                    charged = chargeFor(reservation, attempt.response().meteredCost());
                    budget.commit(reservation, attempt.response().meteredCost());
                }
            } else {
                outcome = attempt.outcome();
                if (reservation != null) {
                    budget.release(reservation);
                }
            }

            AttemptRecord record = new AttemptRecord(index, descriptor.tier(), outcome, attempt.latency(),
                    confidence, charged, attempt.errorDetail());
            provenance.add(record);
            totalCost = totalCost.add(charged);
            publish(new AttemptFinishedEvent(request.requestId(), record, null));
            LOG.debug("Attempt {} on {}: {} (confidence={}, latency={}ms)", index, descriptor.tier().label(),
                    outcome, confidence, attempt.latency().toMillis());

            switch (outcome) {
                case ACCEPTED:
                    return buildResult(attempt.response(), record, totalCost, chainStart, provenance, false, List.of());
                case LOW_CONFIDENCE:
                    if (best == null || confidence > best.record().confidence()) {
                        best = new Candidate(attempt.response(), record);
                    }
                    break;
                case CANCELLED:
                    throw new CancellationException("Request " + request.requestId() + " cancelled during "
                            + descriptor.tier().label());
                default:
                    break;
            }
        }

        if (best != null) {
            LOG.warn("No backend reached confidence {} for request {}; returning degraded result from {}",
                    threshold, request.requestId(), best.record().tier().label());
            String notice = String.format(Locale.ROOT, "Low-confidence result (%.2f < %.2f): manual review recommended",
                    best.record().confidence(), threshold);
            return buildResult(best.response(), best.record(), totalCost, chainStart, provenance, true, List.of(notice));
        }
        LOG.error("All {} backend attempt(s) failed for request {}", provenance.size(), request.requestId());
        throw new AllBackendsFailedException(provenance);
    }

    /**
     * Submits one backend call and waits up to the tier timeout.
     */
    private Attempt execute(InferenceBackend backend, AnalysisRequest request, CancellationToken token) {
        Duration timeout = backend.descriptor().maxLatency();
        long t0 = System.nanoTime();
        Future<BackendResponse> future;
        try {
            future = inferenceExecutor.submit(() -> backend.analyze(request));
        } catch (RejectedExecutionException e) {
            return Attempt.failed(AttemptOutcome.FAILED, elapsed(t0), "inference executor saturated");
        }

        CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true));
        try {
            BackendResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                return Attempt.failed(AttemptOutcome.FAILED, elapsed(t0), "backend returned no response");
            }
            return new Attempt(response, AttemptOutcome.ACCEPTED, elapsed(t0), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("{} timed out after {} ms", backend.tier().label(), timeout.toMillis());
            return Attempt.failed(AttemptOutcome.TIMED_OUT, elapsed(t0), "timed out after " + timeout.toMillis() + "ms");
        } catch (CancellationException e) {
            return Attempt.failed(AttemptOutcome.CANCELLED, elapsed(t0), "cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            token.cancel();
            return Attempt.failed(AttemptOutcome.CANCELLED, elapsed(t0), "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BackendTimeoutException) {
                LOG.warn("{} reported a timeout: {}", backend.tier().label(), cause.getMessage());
                return Attempt.failed(AttemptOutcome.TIMED_OUT, elapsed(t0), cause.getMessage());
            }
            LOG.warn("{} failed: {}", backend.tier().label(), cause.toString());
            return Attempt.failed(AttemptOutcome.FAILED, elapsed(t0), cause.getMessage());
        } finally {
            registration.close();
        }
    }

    private static BigDecimal chargeFor(Reservation reservation, BigDecimal metered) {
        return metered == null ? reservation.amount() : metered.max(BigDecimal.ZERO).min(reservation.amount());
    }

    private AnalysisResult buildResult(BackendResponse response, AttemptRecord source, BigDecimal totalCost,
                                       long chainStart, List<AttemptRecord> provenance, boolean degraded,
                                       List<String> extraNotices) {
        List<String> notices = new ArrayList<>(response.notices());
        notices.addAll(extraNotices);
        return new AnalysisResult(response.hazards(), response.confidence(), source.tier(), totalCost,
                elapsed(chainStart), provenance, degraded, notices);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private void publish(Object event) {
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }

    private record Attempt(BackendResponse response, AttemptOutcome outcome, Duration latency, String errorDetail) {
        static Attempt failed(AttemptOutcome outcome, Duration latency, String detail) {
            return new Attempt(null, outcome, latency, detail);
        }
    }

    private record Candidate(BackendResponse response, AttemptRecord record) {}
}
