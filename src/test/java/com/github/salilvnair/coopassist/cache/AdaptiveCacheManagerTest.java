package com.github.salilvnair.coopassist.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.coopassist.cache.store.SecondaryCacheStore;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import com.github.salilvnair.coopassist.support.ConcurrentRunner;
import com.github.salilvnair.coopassist.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdaptiveCacheManagerTest {

    private static final CacheKey PAYMENT = CacheKey.of(QueryType.POLICY, "怎么付款");
    private static final CacheKey STRAWBERRY = CacheKey.of(QueryType.PRODUCT, "草莓卖不");

    private CoopAssistFlowConfig flowConfig;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        flowConfig = new CoopAssistFlowConfig();
        clock = MutableClock.startingAtEpochDay();
    }

    @Test
    void storedValueIsServedUntilItsTtlRunsOut() {
        AdaptiveCacheManager<String> cache = cache(null);

        cache.put(PAYMENT, "venmo");

        assertEquals(Optional.of(Duration.ofHours(6)), cache.ttlOf(PAYMENT));
        clock.advance(Duration.ofHours(5));
        assertEquals(Optional.of("venmo"), cache.get(PAYMENT));
        clock.advance(Duration.ofHours(2));
        assertTrue(cache.get(PAYMENT).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void frequentlyAskedKeysAreKeptForAWeek() {
        AdaptiveCacheManager<String> cache = cache(null);
        cache.put(PAYMENT, "venmo");

        for (int i = 0; i < 100; i++) {
            cache.get(PAYMENT);
        }

        assertEquals(101L, cache.frequencyOf(PAYMENT));
        assertTrue(cache.ttlOf(PAYMENT).orElseThrow().compareTo(Duration.ofDays(7)) >= 0);
        clock.advance(Duration.ofDays(3));
        assertEquals(Optional.of("venmo"), cache.get(PAYMENT));
    }

    @Test
    void disabledCacheNeitherStoresNorServes() {
        flowConfig.getCache().setEnabled(false);
        AdaptiveCacheManager<String> cache = cache(null);

        cache.put(PAYMENT, "venmo");

        assertTrue(cache.get(PAYMENT).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void maintenanceEvictsExpiredEntriesAndRetargetsLiveOnes() {
        AdaptiveCacheManager<String> cache = cache(null);
        cache.put(PAYMENT, "venmo");
        clock.advance(Duration.ofHours(7));
        cache.put(STRAWBERRY, "有的");
        flowConfig.getCache().setRareTtl(Duration.ofHours(3));
        clock.advance(Duration.ofHours(1));

        MaintenanceReport report = cache.maintain();

        assertEquals(2, report.scanned());
        assertEquals(1, report.evicted());
        assertEquals(1, report.ttlAdjusted());
        assertEquals(Optional.of(Duration.ofHours(3)), cache.ttlOf(STRAWBERRY));
        assertTrue(cache.ttlOf(PAYMENT).isEmpty());
    }

    @Test
    void maintenanceDropsLongIdleCounters() {
        AdaptiveCacheManager<String> cache = cache(null);
        cache.put(PAYMENT, "venmo");
        clock.advance(Duration.ofDays(8));

        MaintenanceReport report = cache.maintain();

        assertEquals(1, report.evicted());
        assertEquals(1, report.countersDropped());
        assertEquals(0L, cache.frequencyOf(PAYMENT));
    }

    @Test
    void invalidationByType() {
        AdaptiveCacheManager<String> cache = cache(null);
        cache.put(PAYMENT, "venmo");
        cache.put(STRAWBERRY, "有的");

        assertEquals(1, cache.invalidateType(QueryType.PRODUCT));
        assertTrue(cache.get(STRAWBERRY).isEmpty());
        assertEquals(1, cache.invalidateAll());
        assertEquals(0, cache.size());
    }

    @Test
    void failingSecondaryStoreIsSkippedDuringBackOff() {
        SecondaryCacheStore store = mock(SecondaryCacheStore.class);
        doThrow(new IllegalStateException("connection refused"))
                .when(store).put(anyString(), anyString(), any(Duration.class));
        AdaptiveCacheManager<String> cache = cache(store);

        cache.put(PAYMENT, "venmo");
        cache.put(STRAWBERRY, "有的");

        assertEquals(Optional.of("venmo"), cache.get(PAYMENT));
        verify(store, times(1)).put(anyString(), anyString(), any(Duration.class));
        CacheStatistics statistics = cache.statistics();
        assertTrue(statistics.secondaryStoreConfigured());
        assertFalse(statistics.secondaryStoreActive());

        clock.advance(Duration.ofSeconds(31));
        assertTrue(cache.statistics().secondaryStoreActive());
    }

    @Test
    void localMissIsFilledFromSecondaryStore() {
        SecondaryCacheStore store = mock(SecondaryCacheStore.class);
        when(store.get("coopassist:cache:" + PAYMENT.asString())).thenReturn(Optional.of("\"venmo\""));
        AdaptiveCacheManager<String> cache = cache(store);

        assertEquals(Optional.of("venmo"), cache.get(PAYMENT));
        assertEquals(1, cache.size());
    }

    @Test
    void unreadableSecondaryValueIsAMiss() {
        SecondaryCacheStore store = mock(SecondaryCacheStore.class);
        when(store.get(anyString())).thenReturn(Optional.of("{not json"));
        AdaptiveCacheManager<String> cache = cache(store);

        assertTrue(cache.get(PAYMENT).isEmpty());
        assertTrue(cache.statistics().secondaryStoreActive());
    }

    @Test
    void statisticsTrackHitsMissesAndHotKeys() {
        AdaptiveCacheManager<String> cache = cache(null);
        cache.get(PAYMENT);
        cache.put(PAYMENT, "venmo");
        cache.get(PAYMENT);
        cache.get(PAYMENT);
        cache.get(STRAWBERRY);

        CacheStatistics statistics = cache.statistics();

        assertEquals(2L, statistics.hits());
        assertEquals(2L, statistics.misses());
        assertEquals(0.5d, statistics.hitRate());
        assertEquals(1, statistics.entries());
        assertEquals(2, statistics.trackedQueries());
        assertEquals(5L, statistics.totalAccesses());
        assertEquals(PAYMENT.query(), statistics.topHotKeys().get(0).query());
        assertEquals(4L, statistics.typeDistribution().get(QueryType.POLICY));
        assertEquals(0, statistics.hotQueries());
    }

    @Test
    void concurrentReadsAndWritesOnOneKeyCountEveryAccess() throws Exception {
        AdaptiveCacheManager<String> cache = cache(null);
        int threads = 8;
        int rounds = 250;

        ConcurrentRunner.run(threads, t -> {
            for (int i = 0; i < rounds; i++) {
                if (cache.get(PAYMENT).isEmpty()) {
                    cache.put(PAYMENT, "venmo-" + t);
                } else {
                    cache.put(PAYMENT, "venmo");
                }
            }
        });

        CacheStatistics statistics = cache.statistics();
        assertEquals(2L * threads * rounds, cache.frequencyOf(PAYMENT));
        assertEquals((long) threads * rounds, statistics.hits() + statistics.misses());
        assertEquals(1, cache.size());
        assertTrue(cache.get(PAYMENT).orElseThrow().startsWith("venmo"));
        assertTrue(cache.ttlOf(PAYMENT).orElseThrow().compareTo(Duration.ofDays(7)) >= 0);
    }

    private AdaptiveCacheManager<String> cache(SecondaryCacheStore store) {
        return new AdaptiveCacheManager<>(new TtlPolicy(flowConfig), flowConfig, clock, new ObjectMapper(), store,
                String.class);
    }
}
