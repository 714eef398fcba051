package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.type.RetrievalTier;
import com.github.salilvnair.coopassist.support.CoopAssistFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.coopassist.support.TestConstants.MSG_HOW_TO_PAY;
import static com.github.salilvnair.coopassist.support.TestConstants.PICKUP_ADDRESS;
import static com.github.salilvnair.coopassist.support.TestConstants.VENMO_HANDLE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyRetrievalEngineTest {

    private final PolicyCorpus corpus = CoopAssistFixtures.corpus();
    private final PolicyRetrievalEngine engine = new PolicyRetrievalEngine(
            corpus, new TfIdfIndex(corpus.sentences()), new DecisiveFactBooster(), CoopAssistFixtures.flowConfig());

    @Test
    void paymentQuestionPutsAccountsFirst() {
        PolicySearchResult result = engine.search(MSG_HOW_TO_PAY);

        assertEquals("payment", result.categoryGuess());
        assertEquals(List.of(RetrievalTier.EXACT, RetrievalTier.KEYWORD), result.tiersInvoked());
        assertEquals(3, result.sentences().size());
        assertTrue(result.contents().get(0).contains(VENMO_HANDLE));
        assertTrue(result.contents().get(1).contains("pay@coopfresh.com"));
    }

    @Test
    void exactHitNeverInvokesStatisticalTier() {
        PolicySearchResult result = engine.search("发布广告");

        assertEquals("general", result.categoryGuess());
        assertEquals(List.of(RetrievalTier.EXACT), result.tiersInvoked());
        assertEquals(1, result.sentences().size());
        assertEquals(RetrievalTier.EXACT, result.sentences().get(0).tier());
    }

    @Test
    void exactHitIsToppedUpFromItsCategory() {
        PolicySearchResult result = engine.search("截单");

        assertFalse(result.invoked(RetrievalTier.STATISTICAL));
        assertEquals(3, result.sentences().size());
        assertTrue(result.contents().get(0).contains("截单"));
        assertEquals(RetrievalTier.EXACT, result.sentences().get(0).tier());
        assertEquals(RetrievalTier.KEYWORD, result.sentences().get(1).tier());
    }

    @Test
    void uncategorizedQueryFallsThroughToStatisticalTier() {
        PolicySearchResult result = engine.search("群聊广告");

        assertTrue(result.invoked(RetrievalTier.STATISTICAL));
        assertFalse(result.invoked(RetrievalTier.KEYWORD));
        assertTrue(result.contents().get(0).contains("广告"));
    }

    @Test
    void unrelatedQueryIsEmpty() {
        PolicySearchResult result = engine.search("章程是啥");

        assertTrue(result.isEmpty());
        assertTrue(result.invoked(RetrievalTier.EMPTY));
        assertEquals("general", result.categoryGuess());
    }

    @Test
    void topKBoundsTheResult() {
        assertEquals(1, engine.search(MSG_HOW_TO_PAY, 1).sentences().size());
        assertTrue(engine.search(MSG_HOW_TO_PAY, 0).isEmpty());
    }

    @Test
    void browsingPickupLeadsWithTheAddress() {
        PolicySearchResult result = engine.browseCategory("pickup");

        assertEquals(2, result.sentences().size());
        assertTrue(result.contents().get(0).contains(PICKUP_ADDRESS));
    }

    @Test
    void browsingEmptyCategoryReportsEmpty() {
        PolicySearchResult result = engine.browseCategory("group_rules");

        assertTrue(result.isEmpty());
        assertTrue(result.invoked(RetrievalTier.EMPTY));
    }
}
