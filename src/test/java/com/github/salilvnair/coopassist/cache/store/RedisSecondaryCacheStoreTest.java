package com.github.salilvnair.coopassist.cache.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.coopassist.cache.AdaptiveCacheManager;
import com.github.salilvnair.coopassist.cache.CacheKey;
import com.github.salilvnair.coopassist.cache.TtlPolicy;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import com.github.salilvnair.coopassist.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisSecondaryCacheStoreTest {

    private static final CacheKey PAYMENT = CacheKey.of(QueryType.POLICY, "怎么付款");

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
    }

    @Test
    void writesWithTtlAndReadsBack() {
        RedisSecondaryCacheStore store = new RedisSecondaryCacheStore(redisTemplate);
        when(valueOps.get("k")).thenReturn("\"v\"");

        store.put("k", "\"v\"", Duration.ofHours(6));

        verify(valueOps).set("k", "\"v\"", Duration.ofHours(6));
        assertEquals(Optional.of("\"v\""), store.get("k"));
        assertEquals(Optional.empty(), store.get("missing"));
    }

    @Test
    void prefixDeleteRemovesMatchingKeys() {
        RedisSecondaryCacheStore store = new RedisSecondaryCacheStore(redisTemplate);
        when(redisTemplate.keys("coopassist:cache:policy:*")).thenReturn(Set.of("coopassist:cache:policy:a"));
        when(redisTemplate.keys("coopassist:cache:chat:*")).thenReturn(Set.of());

        store.deleteByPrefix("coopassist:cache:policy:");
        store.deleteByPrefix("coopassist:cache:chat:");

        verify(redisTemplate).delete(Set.of("coopassist:cache:policy:a"));
        verify(redisTemplate, never()).delete(Set.<String>of());
    }

    @Test
    void timedOutRedisFallsBackToLocalCache() {
        QueryTimeoutException timeout = new QueryTimeoutException("Redis command timed out after 200ms");
        doThrow(timeout).when(valueOps).set(anyString(), anyString(), eq(Duration.ofHours(6)));
        when(valueOps.get(anyString())).thenThrow(timeout);
        CoopAssistFlowConfig flowConfig = new CoopAssistFlowConfig();
        MutableClock clock = MutableClock.startingAtEpochDay();
        AdaptiveCacheManager<String> cache = new AdaptiveCacheManager<>(new TtlPolicy(flowConfig), flowConfig, clock,
                new ObjectMapper(), new RedisSecondaryCacheStore(redisTemplate), String.class);

        cache.put(PAYMENT, "venmo");

        assertEquals(Optional.of("venmo"), cache.get(PAYMENT));
        assertFalse(cache.statistics().secondaryStoreActive());
        verify(valueOps, never()).get(anyString());
    }
}
