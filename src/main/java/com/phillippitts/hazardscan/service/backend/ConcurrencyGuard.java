package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.exception.BackendExceptionBuilder;
import com.phillippitts.hazardscan.exception.BackendFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent access to a scarce inference resource with a semaphore.
 *
 * <p>Used twice: as the cloud concurrent-request cap and as the shared accelerator gate that
 * lets only one local model run at a time. Waiting is bounded; an interrupted waiter gives up
 * immediately so that cancellation and tier timeouts release the caller promptly.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(BackendTier.LOCAL_LARGE);
 * try {
 *     // ... run inference ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
public final class ConcurrencyGuard {
    private static final Logger LOG = LogManager.getLogger(ConcurrencyGuard.class);

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String resourceName;

    /**
     * @param permits number of concurrent holders allowed
     * @param timeout maximum time to wait for a permit
     * @param resourceName name used in messages (for example "accelerator")
     */
    public ConcurrencyGuard(int permits, Duration timeout, String resourceName) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive, got: " + permits);
        }
        this.semaphore = new Semaphore(permits, true);
        this.timeoutMs = timeout.toMillis();
        this.resourceName = resourceName;
    }

    /**
     * Acquires a permit on behalf of {@code tier}, blocking up to the configured timeout.
     *
     * @throws BackendFailureException if no permit is available in time or the thread is
     *         interrupted while waiting
     */
    public void acquire(BackendTier tier) {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                LOG.warn("{} permit not available for {} after {} ms", resourceName, tier.label(), timeoutMs);
                throw BackendExceptionBuilder.create(resourceName + " concurrency limit reached")
                        .tier(tier)
                        .metadata("reason", "concurrency-limit")
                        .metadata("timeoutMs", timeoutMs)
                        .build();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BackendExceptionBuilder.create("Interrupted while waiting for " + resourceName + " permit")
                    .tier(tier)
                    .cause(e)
                    .build();
        }
    }

    /**
     * Releases a previously acquired permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public String resourceName() {
        return resourceName;
    }
}
