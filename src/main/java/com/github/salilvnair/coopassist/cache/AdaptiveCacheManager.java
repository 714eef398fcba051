package com.github.salilvnair.coopassist.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.coopassist.cache.store.SecondaryCacheStore;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Frequency-aware TTL cache. Each key is locked independently through {@link ConcurrentHashMap#compute};
 * nothing takes a lock over the whole structure, including maintenance.
 * <p>
 * A configured {@link SecondaryCacheStore} is written through and consulted on local misses. Any failure of that
 * store is logged, the store is skipped for a back-off window, and the call continues against memory only.
 */
@Slf4j
public class AdaptiveCacheManager<V> {

    private final TtlPolicy ttlPolicy;
    private final CoopAssistFlowConfig flowConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final SecondaryCacheStore secondaryStore;
    private final Class<V> valueType;

    private final ConcurrentHashMap<CacheKey, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, AccessRecord> accesses = new ConcurrentHashMap<>();
    private final Map<QueryType, LongAdder> typeAccesses = new EnumMap<>(QueryType.class);
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final AtomicReference<Instant> secondaryRetryAt = new AtomicReference<>(Instant.MIN);
    private volatile Instant lastMaintenanceAt;

    public AdaptiveCacheManager(TtlPolicy ttlPolicy,
                                CoopAssistFlowConfig flowConfig,
                                Clock clock,
                                ObjectMapper objectMapper,
                                SecondaryCacheStore secondaryStore,
                                Class<V> valueType) {
        this.ttlPolicy = ttlPolicy;
        this.flowConfig = flowConfig;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.secondaryStore = secondaryStore;
        this.valueType = valueType;
        for (QueryType type : QueryType.values()) {
            typeAccesses.put(type, new LongAdder());
        }
    }

    public Optional<V> get(CacheKey key) {
        if (!flowConfig.getCache().isEnabled() || key == null || key.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        long frequency = recordAccess(key, now);
        AtomicReference<V> found = new AtomicReference<>();
        entries.computeIfPresent(key, (k, entry) -> {
            if (entry.isExpired(now)) {
                return null;
            }
            entry.touch(now);
            entry.retarget(ttlPolicy.ttlFor(k.queryType(), frequency));
            found.set(entry.getValue());
            return entry;
        });
        if (found.get() != null) {
            hits.increment();
            return Optional.of(found.get());
        }
        Optional<V> remote = readSecondary(key, now);
        if (remote.isPresent()) {
            hits.increment();
            entries.compute(key, (k, existing) ->
                    new CacheEntry<>(k, remote.get(), ttlPolicy.ttlFor(k.queryType(), frequency), now));
            return remote;
        }
        misses.increment();
        return Optional.empty();
    }

    public void put(CacheKey key, V value) {
        if (!flowConfig.getCache().isEnabled() || key == null || key.isEmpty() || value == null) {
            return;
        }
        Instant now = clock.instant();
        long frequency = recordAccess(key, now);
        Duration ttl = ttlPolicy.ttlFor(key.queryType(), frequency);
        entries.compute(key, (k, existing) -> new CacheEntry<>(k, value, ttl, now));
        writeSecondary(key, value, ttl, now);
        log.debug("Co-op Assist: cached {} ttl={} frequency={}", key.asString(), ttl, frequency);
    }

    public void invalidate(CacheKey key) {
        entries.remove(key);
        Instant now = clock.instant();
        if (secondaryActive(now)) {
            try {
                secondaryStore.delete(secondaryKey(key));
            } catch (RuntimeException ex) {
                secondaryFailed("delete", ex, now);
            }
        }
    }

    public int invalidateType(QueryType type) {
        List<CacheKey> doomed = entries.keySet().stream().filter(k -> k.queryType() == type).toList();
        doomed.forEach(entries::remove);
        Instant now = clock.instant();
        if (secondaryActive(now)) {
            try {
                secondaryStore.deleteByPrefix(flowConfig.getCache().getSecondary().getKeyPrefix()
                        + type.name().toLowerCase() + ":");
            } catch (RuntimeException ex) {
                secondaryFailed("deleteByPrefix", ex, now);
            }
        }
        log.info("Co-op Assist: invalidated {} cached {} entries.", doomed.size(), type);
        return doomed.size();
    }

    public int invalidateAll() {
        int total = 0;
        for (QueryType type : QueryType.values()) {
            total += invalidateType(type);
        }
        return total;
    }

    /**
     * Walks a snapshot of the keys in bounded batches. Expired entries are evicted, live entries get their TTL
     * recomputed from the current access frequency, and counters idle past the retention window are dropped.
     */
    public MaintenanceReport maintain() {
        Instant now = clock.instant();
        int batchSize = Math.max(1, flowConfig.getCache().getMaintenanceBatchSize());
        List<CacheKey> keys = new ArrayList<>(entries.keySet());
        int evicted = 0;
        int adjusted = 0;
        int batches = 0;
        for (int start = 0; start < keys.size(); start += batchSize) {
            batches++;
            for (CacheKey key : keys.subList(start, Math.min(start + batchSize, keys.size()))) {
                AtomicBoolean removed = new AtomicBoolean(false);
                AtomicBoolean retargeted = new AtomicBoolean(false);
                entries.computeIfPresent(key, (k, entry) -> {
                    if (entry.isExpired(now)) {
                        removed.set(true);
                        return null;
                    }
                    retargeted.set(entry.retarget(ttlPolicy.ttlFor(k.queryType(), frequencyOf(k))));
                    return entry;
                });
                if (removed.get()) {
                    evicted++;
                }
                if (retargeted.get()) {
                    adjusted++;
                }
            }
        }
        int dropped = dropIdleCounters(now);
        lastMaintenanceAt = now;
        return new MaintenanceReport(keys.size(), evicted, adjusted, dropped, batches);
    }

    public CacheStatistics statistics() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long lookups = hitCount + missCount;
        long totalAccesses = 0L;
        int hot = 0;
        List<CacheStatistics.HotKey> ranked = new ArrayList<>();
        for (Map.Entry<CacheKey, AccessRecord> e : accesses.entrySet()) {
            long count = e.getValue().count.get();
            totalAccesses += count;
            if (ttlPolicy.isHot(count)) {
                hot++;
            }
            ranked.add(new CacheStatistics.HotKey(e.getKey().query(), e.getKey().queryType(), count));
        }
        ranked.sort(Comparator.comparingLong(CacheStatistics.HotKey::frequency).reversed());
        List<CacheStatistics.HotKey> top = ranked.stream().limit(flowConfig.getCache().getHotKeyLimit()).toList();
        Map<QueryType, Long> distribution = new EnumMap<>(QueryType.class);
        typeAccesses.forEach((type, adder) -> distribution.put(type, adder.sum()));
        return new CacheStatistics(
                hitCount,
                missCount,
                lookups == 0 ? 0.0d : (double) hitCount / lookups,
                entries.size(),
                accesses.size(),
                totalAccesses,
                hot,
                top,
                distribution,
                secondaryStore != null,
                secondaryActive(clock.instant()),
                lastMaintenanceAt);
    }

    public long frequencyOf(CacheKey key) {
        AccessRecord record = accesses.get(key);
        return record == null ? 0L : record.count.get();
    }

    /** Presence check that records no access. */
    public boolean contains(CacheKey key) {
        CacheEntry<V> entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.instant());
    }

    public Optional<Duration> ttlOf(CacheKey key) {
        CacheEntry<V> entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.getTtl());
    }

    public int size() {
        return entries.size();
    }

    private long recordAccess(CacheKey key, Instant now) {
        typeAccesses.get(key.queryType()).increment();
        AccessRecord record = accesses.compute(key, (k, existing) -> existing == null ? new AccessRecord() : existing);
        record.lastAccessAt = now;
        return record.count.incrementAndGet();
    }

    private int dropIdleCounters(Instant now) {
        Instant cutoff = now.minus(flowConfig.getCache().getStatsRetention());
        List<CacheKey> idle = accesses.entrySet().stream()
                .filter(e -> e.getValue().lastAccessAt.isBefore(cutoff))
                .map(Map.Entry::getKey)
                .filter(k -> !entries.containsKey(k))
                .toList();
        int dropped = 0;
        for (CacheKey key : idle) {
            if (accesses.computeIfPresent(key, (k, r) -> r.lastAccessAt.isBefore(cutoff) ? null : r) == null) {
                dropped++;
            }
        }
        return dropped;
    }

    private Optional<V> readSecondary(CacheKey key, Instant now) {
        if (!secondaryActive(now)) {
            return Optional.empty();
        }
        try {
            Optional<String> json = secondaryStore.get(secondaryKey(key));
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), valueType));
        } catch (JsonProcessingException ex) {
            log.warn("Co-op Assist: discarding unreadable secondary cache value for {}. cause={}",
                    key.asString(), ex.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            secondaryFailed("get", ex, now);
            return Optional.empty();
        }
    }

    private void writeSecondary(CacheKey key, V value, Duration ttl, Instant now) {
        if (!secondaryActive(now)) {
            return;
        }
        try {
            secondaryStore.put(secondaryKey(key), objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException ex) {
            log.warn("Co-op Assist: value for {} is not serializable, kept in memory only. cause={}",
                    key.asString(), ex.getOriginalMessage());
        } catch (RuntimeException ex) {
            secondaryFailed("put", ex, now);
        }
    }

    private boolean secondaryActive(Instant now) {
        return secondaryStore != null && !now.isBefore(secondaryRetryAt.get());
    }

    private void secondaryFailed(String operation, RuntimeException ex, Instant now) {
        Duration backoff = flowConfig.getCache().getSecondary().getFailureBackoff();
        secondaryRetryAt.set(now.plus(backoff));
        log.warn("Co-op Assist: secondary cache {} failed, serving from memory for {}. cause={}",
                operation, backoff, ex.getMessage());
    }

    private String secondaryKey(CacheKey key) {
        return flowConfig.getCache().getSecondary().getKeyPrefix() + key.asString();
    }

    private static final class AccessRecord {
        private final AtomicLong count = new AtomicLong();
        private volatile Instant lastAccessAt = Instant.EPOCH;
    }
}
