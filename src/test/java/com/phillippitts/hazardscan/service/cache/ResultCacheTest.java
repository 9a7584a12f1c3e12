package com.phillippitts.hazardscan.service.cache;

import com.phillippitts.hazardscan.domain.AnalysisResult;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.domain.CacheKey;
import com.phillippitts.hazardscan.domain.CancellationToken;
import com.phillippitts.hazardscan.domain.WorkType;
import com.phillippitts.hazardscan.service.orchestration.event.CacheEvictionEvent;
import com.phillippitts.hazardscan.service.orchestration.event.CacheLookupEvent;
import com.phillippitts.hazardscan.testutil.EventCapturingPublisher;
import com.phillippitts.hazardscan.testutil.MutableClock;
import com.phillippitts.hazardscan.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ResultCacheTest {

    private static final Duration TTL = Duration.ofHours(4);

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T08:00:00Z");
        publisher = new EventCapturingPublisher();
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ResultCache syncCache(int capacity) {
        return new ResultCache(capacity, TTL, clock, new SyncExecutor(), publisher);
    }

    private static CacheKey key(String fingerprint) {
        return new CacheKey(fingerprint, WorkType.ROOFING);
    }

    private static AnalysisResult result(BackendTier tier) {
        return new AnalysisResult(List.of(), 0.9, tier, BigDecimal.ZERO, Duration.ofMillis(10),
                List.of(), false, List.of());
    }

    @Test
    void shouldComputeOnceAndServeRepeatedLookupsFromCache() {
        ResultCache cache = syncCache(8);
        AtomicInteger computations = new AtomicInteger();

        AnalysisResult first = cache.getOrCompute(key("a"), t -> {
            computations.incrementAndGet();
            return result(BackendTier.LOCAL_SMALL);
        });
        AnalysisResult second = cache.getOrCompute(key("a"), t -> {
            computations.incrementAndGet();
            return result(BackendTier.CLOUD);
        });

        assertThat(second).isSameAs(first);
        assertThat(computations.get()).isEqualTo(1);
        assertThat(cache.stats()).isEqualTo(new CacheStats(1, 1, 0, 0, 1));
        assertThat(publisher.eventsOf(CacheLookupEvent.class)).extracting(CacheLookupEvent::outcome)
                .containsExactly(CacheOutcome.MISS, CacheOutcome.HIT);
    }

    @Test
    void shouldCoalesceConcurrentRequestsForSameKey() throws Exception {
        ResultCache cache = new ResultCache(8, TTL, clock, pool, publisher);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger computations = new AtomicInteger();

        CompletableFuture<AnalysisResult> first = cache.getOrComputeAsync(key("a"), t -> {
            computations.incrementAndGet();
            awaitQuietly(release);
            return result(BackendTier.LOCAL_LARGE);
        }, CancellationToken.create());
        CompletableFuture<AnalysisResult> second = cache.getOrComputeAsync(key("a"), t -> {
            computations.incrementAndGet();
            return result(BackendTier.CLOUD);
        }, CancellationToken.create());

        assertThat(second).isNotDone();
        release.countDown();

        AnalysisResult a = first.get(5, TimeUnit.SECONDS);
        AnalysisResult b = second.get(5, TimeUnit.SECONDS);
        assertThat(b).isSameAs(a);
        assertThat(a.sourceTier()).isEqualTo(BackendTier.LOCAL_LARGE);
        assertThat(computations.get()).isEqualTo(1);
        assertThat(cache.stats().coalescedWaits()).isEqualTo(1);
    }

    @Test
    void shouldShareFailureWithWaitersButNeverStoreIt() {
        ResultCache cache = syncCache(8);

        assertThatThrownBy(() -> cache.getOrCompute(key("a"), t -> {
            throw new IllegalStateException("chain exhausted");
        })).isInstanceOf(IllegalStateException.class).hasMessage("chain exhausted");

        assertThat(cache.contains(key("a"))).isFalse();
        AnalysisResult retried = cache.getOrCompute(key("a"), t -> result(BackendTier.EMERGENCY));
        assertThat(retried.sourceTier()).isEqualTo(BackendTier.EMERGENCY);
    }

    @Test
    void shouldTreatExpiredEntryAsMiss() {
        ResultCache cache = syncCache(8);
        cache.getOrCompute(key("a"), t -> result(BackendTier.LOCAL_SMALL));

        clock.advance(TTL.minusSeconds(1));
        assertThat(cache.contains(key("a"))).isTrue();

        clock.advance(Duration.ofSeconds(1));
        AnalysisResult recomputed = cache.getOrCompute(key("a"), t -> result(BackendTier.CLOUD));

        assertThat(recomputed.sourceTier()).isEqualTo(BackendTier.CLOUD);
        assertThat(publisher.eventsOf(CacheEvictionEvent.class)).extracting(CacheEvictionEvent::reason)
                .containsExactly(CacheEvictionEvent.Reason.EXPIRED);
        assertThat(publisher.eventsOf(CacheLookupEvent.class)).extracting(CacheLookupEvent::outcome)
                .containsExactly(CacheOutcome.MISS, CacheOutcome.EXPIRED);
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        ResultCache cache = syncCache(2);
        cache.getOrCompute(key("a"), t -> result(BackendTier.LOCAL_SMALL));
        cache.getOrCompute(key("b"), t -> result(BackendTier.LOCAL_SMALL));
        // Touch a so b becomes eldest
        cache.getOrCompute(key("a"), t -> result(BackendTier.CLOUD));

        cache.getOrCompute(key("c"), t -> result(BackendTier.LOCAL_SMALL));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.contains(key("b"))).isFalse();
        assertThat(cache.contains(key("a"))).isTrue();
        assertThat(cache.contains(key("c"))).isTrue();
        assertThat(publisher.eventsOf(CacheEvictionEvent.class).get(0).key()).isEqualTo(key("b"));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 16})
    void shouldNeverHoldMoreThanCapacity(int capacity) {
        ResultCache cache = syncCache(capacity);

        for (int i = 0; i < capacity + 5; i++) {
            cache.getOrCompute(key("k" + i), t -> result(BackendTier.LOCAL_SMALL));
        }

        assertThat(cache.size()).isEqualTo(capacity);
        assertThat(cache.stats().evictions()).isEqualTo(5);
    }

    @Test
    void shouldCancelSharedComputationOnlyWhenAllWaitersCancel() {
        ResultCache cache = new ResultCache(8, TTL, clock, pool, publisher);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<CancellationToken> shared = new AtomicReference<>();
        CancellationToken callerA = CancellationToken.create();
        CancellationToken callerB = CancellationToken.create();

        CompletableFuture<AnalysisResult> a = cache.getOrComputeAsync(key("a"), t -> {
            shared.set(t);
            awaitQuietly(release);
            if (t.isCancelled()) {
                throw new CancellationException("abandoned");
            }
            return result(BackendTier.LOCAL_SMALL);
        }, callerA);
        CompletableFuture<AnalysisResult> b = cache.getOrComputeAsync(key("a"), t -> result(BackendTier.CLOUD), callerB);
        await().atMost(Duration.ofSeconds(5)).until(() -> shared.get() != null);

        callerA.cancel();

        assertThat(a).isCompletedExceptionally();
        assertThat(b).isNotDone();
        assertThat(shared.get().isCancelled()).isFalse();

        callerB.cancel();

        assertThat(b).isCompletedExceptionally();
        assertThat(shared.get().isCancelled()).isTrue();
        release.countDown();
    }

    @Test
    void shouldInvalidateAndClearEntries() {
        ResultCache cache = syncCache(8);
        cache.getOrCompute(key("a"), t -> result(BackendTier.LOCAL_SMALL));
        cache.getOrCompute(key("b"), t -> result(BackendTier.LOCAL_SMALL));

        cache.invalidate(key("a"));
        assertThat(cache.contains(key("a"))).isFalse();

        cache.clear();
        assertThat(cache.size()).isZero();
        assertThat(publisher.eventsOf(CacheEvictionEvent.class)).extracting(CacheEvictionEvent::reason)
                .containsOnly(CacheEvictionEvent.Reason.INVALIDATED)
                .hasSize(2);
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new ResultCache(0, TTL, clock, new SyncExecutor(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResultCache(8, Duration.ZERO, clock, new SyncExecutor(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
