package com.github.salilvnair.coopassist.cache;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutated only inside {@code ConcurrentHashMap.compute*} for its own key. Statistics, maintenance and
 * {@code ttlOf} read it without that lock, so the mutable fields are volatile.
 */
@Getter
public class CacheEntry<V> {

    private final CacheKey key;
    private final V value;
    private final Instant writtenAt;
    private volatile Duration ttl;
    private volatile Instant expiresAt;
    private volatile Instant lastAccessAt;

    public CacheEntry(CacheKey key, V value, Duration ttl, Instant writtenAt) {
        this.key = key;
        this.value = value;
        this.writtenAt = writtenAt;
        this.lastAccessAt = writtenAt;
        retarget(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    void touch(Instant now) {
        this.lastAccessAt = now;
    }

    /** Applies a new TTL measured from the original write. Returns true when the TTL changed. */
    boolean retarget(Duration newTtl) {
        if (newTtl.equals(this.ttl)) {
            return false;
        }
        this.ttl = newTtl;
        this.expiresAt = writtenAt.plus(newTtl);
        return true;
    }
}
