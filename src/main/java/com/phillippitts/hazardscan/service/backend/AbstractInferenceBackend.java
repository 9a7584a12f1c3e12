package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.exception.BackendException;
import com.phillippitts.hazardscan.exception.BackendExceptionBuilder;
import jakarta.annotation.PreDestroy;

import java.util.Objects;

/**
 * Base class for backends providing lifecycle state and consistent error wrapping.
 *
 * <p><b>Lifecycle:</b> uninitialized, then initialized by {@link #initialize()}, then closed by
 * {@link #close()}. Both transitions are idempotent and synchronized on {@link #lock}.
 *
 * <p><b>Template Method:</b> {@link #analyze(AnalysisRequest)} checks the lifecycle state,
 * delegates to {@link #doAnalyze(AnalysisRequest)} and wraps anything that is not already a
 * {@link BackendException}.
 */
public abstract class AbstractInferenceBackend implements InferenceBackend {

    protected final Object lock = new Object();
    protected boolean initialized = false;
    protected boolean closed = false;

    private final BackendDescriptor descriptor;

    protected AbstractInferenceBackend(BackendDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    @Override
    public final BackendDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /** Backend-specific initialization; called under {@link #lock}. */
    protected void doInitialize() {
    }

    @Override
    public boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /** Backend-specific cleanup; must not throw. */
    protected void doClose() {
    }

    @Override
    public final BackendResponse analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        ensureInitialized();
        long t0 = System.nanoTime();
        try {
            return doAnalyze(request);
        } catch (Exception e) {
            throw handleBackendError(e, (System.nanoTime() - t0) / 1_000_000L);
        }
    }

    /**
     * Performs the actual inference.
     *
     * @throws Exception any failure; wrapped into a {@link BackendException} by the caller
     */
    protected abstract BackendResponse doAnalyze(AnalysisRequest request) throws Exception;

    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw BackendExceptionBuilder.create("Backend not initialized or closed")
                        .tier(descriptor.tier())
                        .build();
            }
        }
    }

    /**
     * Preserves {@link BackendException}s and wraps everything else with tier context.
     * Restores the interrupt flag when the cause is an interruption.
     */
    protected final BackendException handleBackendError(Exception exception, long elapsedMs) {
        if (exception instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (exception instanceof BackendException be) {
            return be;
        }
        return BackendExceptionBuilder.create(descriptor.tier().label() + " inference failed: "
                        + exception.getMessage())
                .tier(descriptor.tier())
                .cause(exception)
                .durationMs(elapsedMs)
                .build();
    }
}
