package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TtlPolicyTest {

    private final CoopAssistFlowConfig flowConfig = new CoopAssistFlowConfig();
    private final TtlPolicy ttlPolicy = new TtlPolicy(flowConfig);

    @Test
    void policyAnswersLiveLongestAndChatShortest() {
        assertEquals(Duration.ofHours(48), ttlPolicy.baseTtl(QueryType.POLICY));
        assertEquals(Duration.ofHours(24), ttlPolicy.baseTtl(QueryType.GENERAL));
        assertEquals(Duration.ofHours(12), ttlPolicy.baseTtl(QueryType.PRODUCT));
        assertEquals(Duration.ofHours(8), ttlPolicy.baseTtl(QueryType.CHAT));
    }

    @Test
    void hotKeysLiveAtLeastSevenDays() {
        for (QueryType type : QueryType.values()) {
            assertTrue(ttlPolicy.ttlFor(type, 101L).compareTo(Duration.ofDays(7)) >= 0);
        }
        assertTrue(ttlPolicy.isHot(101L));
        assertFalse(ttlPolicy.isHot(100L));
    }

    @Test
    void warmKeysKeepTheirBaseTtl() {
        assertEquals(Duration.ofHours(48), ttlPolicy.ttlFor(QueryType.POLICY, 11L));
        assertEquals(Duration.ofHours(48), ttlPolicy.ttlFor(QueryType.POLICY, 100L));
    }

    @Test
    void rareKeysAreCappedAtSixHours() {
        assertEquals(Duration.ofHours(6), ttlPolicy.ttlFor(QueryType.POLICY, 1L));
        assertEquals(Duration.ofHours(6), ttlPolicy.ttlFor(QueryType.CHAT, 10L));
    }

    @Test
    void rareCapNeverExtendsAShortBase() {
        flowConfig.getCache().setChatTtl(Duration.ofHours(2));

        assertEquals(Duration.ofHours(2), ttlPolicy.ttlFor(QueryType.CHAT, 1L));
    }
}
