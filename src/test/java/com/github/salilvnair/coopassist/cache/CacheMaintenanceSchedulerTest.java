package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.support.EngineHarness;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheMaintenanceSchedulerTest {

    @Test
    void maintenancePassRefillsExpiredPreheatEntries() {
        EngineHarness harness = CachePreheaterTest.harness();
        CachePreheater preheater = CachePreheaterTest.preheater(harness);
        CacheMaintenanceScheduler scheduler = new CacheMaintenanceScheduler(harness.cache(), preheater);
        preheater.preheat();
        CacheKey key = preheater.keyFor("配送时间");

        harness.clock().advance(Duration.ofHours(7));
        scheduler.runMaintenance();

        assertTrue(harness.cache().contains(key));
        assertEquals(1, harness.cache().size());
    }

    @Test
    void maintenancePassSkipsRefillWhenPreheatIsDisabled() {
        EngineHarness harness = CachePreheaterTest.harness();
        CachePreheater preheater = CachePreheaterTest.preheater(harness);
        CacheMaintenanceScheduler scheduler = new CacheMaintenanceScheduler(harness.cache(), preheater);
        preheater.preheat();
        harness.flowConfig().getCache().setPreheatEnabled(false);

        harness.clock().advance(Duration.ofHours(7));
        scheduler.runMaintenance();

        assertFalse(harness.cache().contains(preheater.keyFor("配送时间")));
        assertEquals(0, harness.cache().size());
    }
}
