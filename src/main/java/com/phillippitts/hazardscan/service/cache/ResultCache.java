package com.phillippitts.hazardscan.service.cache;

import com.phillippitts.hazardscan.domain.AnalysisResult;
import com.phillippitts.hazardscan.domain.CacheKey;
import com.phillippitts.hazardscan.domain.CancellationToken;
import com.phillippitts.hazardscan.exception.HazardScanException;
import com.phillippitts.hazardscan.service.orchestration.event.CacheEvictionEvent;
import com.phillippitts.hazardscan.service.orchestration.event.CacheLookupEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Bounded LRU cache of analysis results with single-flight computation per key.
 *
 * <p><b>Semantics:</b>
 * <ul>
 *   <li>Entries expire {@code ttl} after creation; an expired entry is a miss.</li>
 *   <li>At most one computation per key is in flight. Concurrent callers for the same key wait
 *       on it and share its outcome, success or failure.</li>
 *   <li>Failures are never stored.</li>
 *   <li>A caller that cancels stops waiting. The shared computation is cancelled (through the
 *       {@link CancellationToken} handed to it) only once every waiter has cancelled.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> all map mutation happens under a single lock. Computations run on
 * the supplied executor, never under the lock or on the caller's thread (unless the executor
 * itself runs tasks inline). Events are published after the lock is released.
 */
public class ResultCache {
    private static final Logger LOG = LogManager.getLogger(ResultCache.class);

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;

    private final Object lock = new Object();
    // Access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<CacheKey, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<CacheKey, InFlight> inFlight = new HashMap<>();

    private long hits;
    private long misses;
    private long evictions;
    private long coalescedWaits;

    private record Entry(AnalysisResult result, Instant createdAt) {}

    private static final class InFlight {
        final CompletableFuture<AnalysisResult> future = new CompletableFuture<>();
        final CancellationToken token = CancellationToken.create();
        int waiters;
    }

    public ResultCache(int capacity, Duration ttl, Clock clock, Executor executor,
                       ApplicationEventPublisher publisher) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = publisher;
    }

    /**
     * Returns the cached result for {@code key}, or computes it once.
     *
     * @see #getOrCompute(CacheKey, Function, CancellationToken)
     */
    public AnalysisResult getOrCompute(CacheKey key, Function<CancellationToken, AnalysisResult> compute) {
        return getOrCompute(key, compute, CancellationToken.create());
    }

    /**
     * Blocking form of {@link #getOrComputeAsync(CacheKey, Function, CancellationToken)}.
     * Interrupting the waiting thread cancels {@code callerToken}.
     *
     * @return the shared result
     * @throws CancellationException if this caller cancelled or was interrupted while waiting
     * @throws RuntimeException the computation's failure, shared by all waiters
     */
    public AnalysisResult getOrCompute(CacheKey key,
                                       Function<CancellationToken, AnalysisResult> compute,
                                       CancellationToken callerToken) {
        CompletableFuture<AnalysisResult> future = getOrComputeAsync(key, compute, callerToken);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callerToken.cancel();
            throw new CancellationException("Interrupted while waiting for " + key);
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        }
    }

    /**
     * Returns the cached result for {@code key}, or joins/starts the computation for it.
     *
     * @param key cache key
     * @param compute computation run on the cache executor; receives a token that is cancelled
     *                when every waiter has given up
     * @param callerToken cancels this caller's wait only
     * @return future completed with the shared result or failure, or cancelled for this caller
     */
    public CompletableFuture<AnalysisResult> getOrComputeAsync(CacheKey key,
                                                               Function<CancellationToken, AnalysisResult> compute,
                                                               CancellationToken callerToken) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(compute, "compute");
        Objects.requireNonNull(callerToken, "callerToken");

        List<Object> events = new ArrayList<>(2);
        InFlight flight = null;
        AnalysisResult hit = null;
        boolean owner = false;
        synchronized (lock) {
            Entry entry = entries.get(key);
            CacheOutcome missKind = CacheOutcome.MISS;
            if (entry != null && !isExpired(entry)) {
                hits++;
                hit = entry.result();
                events.add(new CacheLookupEvent(key, CacheOutcome.HIT, null));
            } else if (entry != null) {
                entries.remove(key);
                evictions++;
                missKind = CacheOutcome.EXPIRED;
                events.add(new CacheEvictionEvent(key, CacheEvictionEvent.Reason.EXPIRED, null));
            }
            if (hit == null) {
                flight = joinOrCreate(key, missKind, events);
                owner = flight.waiters == 0;
                flight.waiters++;
            }
        }
        publishAll(events);
        if (hit != null) {
            return CompletableFuture.completedFuture(hit);
        }

        CompletableFuture<AnalysisResult> mine = join(key, flight, callerToken);
        if (owner) {
            start(key, flight, compute);
        }
        return mine;
    }

    // Called under lock
    private InFlight joinOrCreate(CacheKey key, CacheOutcome missKind, List<Object> events) {
        InFlight flight = inFlight.get(key);
        if (flight != null) {
            coalescedWaits++;
            events.add(new CacheLookupEvent(key, CacheOutcome.COALESCED, null));
            return flight;
        }
        misses++;
        flight = new InFlight();
        inFlight.put(key, flight);
        events.add(new CacheLookupEvent(key, missKind, null));
        return flight;
    }

    private void start(CacheKey key, InFlight flight, Function<CancellationToken, AnalysisResult> compute) {
        Runnable task = () -> {
            try {
                AnalysisResult result = Objects.requireNonNull(compute.apply(flight.token),
                        "computation returned null");
                store(key, flight, result);
                flight.future.complete(result);
            } catch (Throwable t) {
                synchronized (lock) {
                    inFlight.remove(key, flight);
                }
                flight.future.completeExceptionally(t);
            }
        };
        try {
            executor.execute(task);
        } catch (RuntimeException rejected) {
            synchronized (lock) {
                inFlight.remove(key, flight);
            }
            flight.future.completeExceptionally(rejected);
        }
    }

    private void store(CacheKey key, InFlight flight, AnalysisResult result) {
        List<Object> events = new ArrayList<>(1);
        synchronized (lock) {
            inFlight.remove(key, flight);
            entries.put(key, new Entry(result, clock.instant()));
            Iterator<Map.Entry<CacheKey, Entry>> it = entries.entrySet().iterator();
            while (entries.size() > capacity && it.hasNext()) {
                CacheKey eldest = it.next().getKey();
                it.remove();
                evictions++;
                events.add(new CacheEvictionEvent(eldest, CacheEvictionEvent.Reason.CAPACITY, null));
            }
        }
        publishAll(events);
    }

    private CompletableFuture<AnalysisResult> join(CacheKey key, InFlight flight, CancellationToken callerToken) {
        CompletableFuture<AnalysisResult> mine = new CompletableFuture<>();
        CancellationToken.Registration registration = callerToken.onCancel(() -> {
            if (mine.completeExceptionally(new CancellationException("Caller cancelled"))) {
                leave(key, flight);
            }
        });
        flight.future.whenComplete((result, error) -> {
            registration.close();
            if (error != null) {
                mine.completeExceptionally(error);
            } else {
                mine.complete(result);
            }
        });
        return mine;
    }

    private void leave(CacheKey key, InFlight flight) {
        boolean cancelShared = false;
        synchronized (lock) {
            flight.waiters--;
            if (flight.waiters <= 0 && !flight.future.isDone()) {
                inFlight.remove(key, flight);
                cancelShared = true;
            }
        }
        if (cancelShared) {
            LOG.debug("All waiters for {} cancelled; cancelling computation", key);
            flight.token.cancel();
        }
    }

    static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new HazardScanException("Cached computation failed", cause);
    }

    private boolean isExpired(Entry entry) {
        return !clock.instant().isBefore(entry.createdAt().plus(ttl));
    }

    /** Removes a stored entry; an in-flight computation for the key is unaffected. */
    public void invalidate(CacheKey key) {
        boolean removed;
        synchronized (lock) {
            removed = entries.remove(key) != null;
        }
        if (removed) {
            publishAll(List.of(new CacheEvictionEvent(key, CacheEvictionEvent.Reason.INVALIDATED, null)));
        }
    }

    public void clear() {
        List<Object> events = new ArrayList<>();
        synchronized (lock) {
            entries.keySet().forEach(k ->
                    events.add(new CacheEvictionEvent(k, CacheEvictionEvent.Reason.INVALIDATED, null)));
            entries.clear();
        }
        publishAll(events);
    }

    public CacheStats stats() {
        synchronized (lock) {
            return new CacheStats(hits, misses, evictions, coalescedWaits, entries.size());
        }
    }

    /** Number of stored entries, expired ones included until they are looked up. */
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /** Whether a live entry exists. Counts as an access for LRU ordering, not as a hit. */
    public boolean contains(CacheKey key) {
        synchronized (lock) {
            Entry entry = entries.get(key);
            return entry != null && !isExpired(entry);
        }
    }

    private void publishAll(List<Object> events) {
        if (publisher == null) {
            return;
        }
        for (Object event : events) {
            publisher.publishEvent(event);
        }
    }
}
