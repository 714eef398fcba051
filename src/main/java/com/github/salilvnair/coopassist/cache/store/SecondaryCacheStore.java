package com.github.salilvnair.coopassist.cache.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Optional shared cache behind the in-process cache. Implementations may throw on I/O failure;
 * the cache manager treats every failure as a miss and keeps serving from memory.
 */
public interface SecondaryCacheStore {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void delete(String key);

    void deleteByPrefix(String prefix);
}
