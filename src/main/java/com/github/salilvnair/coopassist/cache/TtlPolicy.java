package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Base TTL per query type (policy longest, chat shortest), stretched for hot keys and shortened for rare ones.
 */
@RequiredArgsConstructor
@Component
public class TtlPolicy {

    private final CoopAssistFlowConfig flowConfig;

    public Duration baseTtl(QueryType type) {
        CoopAssistFlowConfig.Cache cache = flowConfig.getCache();
        return switch (type) {
            case POLICY -> cache.getPolicyTtl();
            case PRODUCT -> cache.getProductTtl();
            case CHAT -> cache.getChatTtl();
            case GENERAL -> cache.getGeneralTtl();
        };
    }

    public Duration ttlFor(QueryType type, long frequency) {
        CoopAssistFlowConfig.Cache cache = flowConfig.getCache();
        Duration base = baseTtl(type);
        if (frequency > cache.getHotThreshold()) {
            return max(base, cache.getHotTtl());
        }
        if (frequency > cache.getWarmThreshold()) {
            return base;
        }
        return min(base, cache.getRareTtl());
    }

    public boolean isHot(long frequency) {
        return frequency > flowConfig.getCache().getHotThreshold();
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
