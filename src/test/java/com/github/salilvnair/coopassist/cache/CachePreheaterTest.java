package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.support.EngineHarness;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.github.salilvnair.coopassist.support.TestConstants.USER_ALICE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CachePreheaterTest {

    @Test
    void preheatCachesOnlyTieredAnswers() {
        EngineHarness harness = harness();
        CachePreheater preheater = preheater(harness);

        assertEquals(1, preheater.preheat());
        assertEquals(0, harness.sessions().activeSessions());
        assertTrue(harness.send(USER_ALICE, "配送时间").fromCache());
    }

    @Test
    void refillLeavesPresentEntriesAlone() {
        EngineHarness harness = harness();
        CachePreheater preheater = preheater(harness);
        preheater.preheat();
        CacheKey key = preheater.keyFor("配送时间");
        long frequency = harness.cache().frequencyOf(key);

        assertEquals(0, preheater.refill());
        assertEquals(frequency, harness.cache().frequencyOf(key));
    }

    @Test
    void refillRestoresExpiredPreheatEntries() {
        EngineHarness harness = harness();
        CachePreheater preheater = preheater(harness);
        preheater.preheat();
        CacheKey key = preheater.keyFor("配送时间");
        assertTrue(harness.cache().contains(key));

        harness.clock().advance(Duration.ofHours(7));
        harness.cache().maintain();
        assertFalse(harness.cache().contains(key));

        assertEquals(1, preheater.refill());
        assertTrue(harness.cache().contains(key));
    }

    @Test
    void applicationReadyDoesNothingWhenPreheatIsDisabled() {
        EngineHarness harness = EngineHarness.rulesOnly();
        harness.flowConfig().getCache().setPreheatEnabled(false);
        CachePreheater preheater = preheater(harness);

        preheater.onApplicationReady();

        assertFalse(preheater.isEnabled());
        assertEquals(0, harness.cache().size());
    }

    static EngineHarness harness() {
        EngineHarness harness = EngineHarness.rulesOnly();
        harness.flowConfig().getCache().setPreheatEnabled(true);
        harness.flowConfig().getCache().setPreheatPolicyQueries(new ArrayList<>(List.of("配送时间")));
        harness.flowConfig().getCache().setPreheatProductQueries(new ArrayList<>(List.of("鸡")));
        return harness;
    }

    static CachePreheater preheater(EngineHarness harness) {
        return new CachePreheater(harness.engine(), harness.cache(), harness.queryTypeResolver(), harness.flowConfig());
    }
}
