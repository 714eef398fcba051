package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.engine.type.QueryType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CacheStatistics(
        long hits,
        long misses,
        double hitRate,
        int entries,
        int trackedQueries,
        long totalAccesses,
        int hotQueries,
        List<HotKey> topHotKeys,
        Map<QueryType, Long> typeDistribution,
        boolean secondaryStoreConfigured,
        boolean secondaryStoreActive,
        Instant lastMaintenanceAt
) {
    public record HotKey(String query, QueryType queryType, long frequency) {}
}
