package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.engine.model.EngineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class CacheMaintenanceScheduler {

    private final AdaptiveCacheManager<EngineResult> cache;
    private final CachePreheater preheater;

    @Scheduled(
            initialDelayString = "${coopassist.flow.cache.maintenance-interval-ms:3600000}",
            fixedDelayString = "${coopassist.flow.cache.maintenance-interval-ms:3600000}"
    )
    public void runMaintenance() {
        MaintenanceReport report = cache.maintain();
        int refilled = preheater.isEnabled() ? preheater.refill() : 0;
        CacheStatistics stats = cache.statistics();
        log.info("Co-op Assist cache maintenance: scanned={} evicted={} ttlAdjusted={} countersDropped={} batches={} "
                        + "preheatRefilled={}",
                report.scanned(), report.evicted(), report.ttlAdjusted(), report.countersDropped(), report.batches(),
                refilled);
        log.info("Co-op Assist cache stats: entries={} hits={} misses={} hitRate={} hotQueries={} distribution={}",
                stats.entries(), stats.hits(), stats.misses(), String.format("%.2f", stats.hitRate()),
                stats.hotQueries(), stats.typeDistribution());
    }
}
