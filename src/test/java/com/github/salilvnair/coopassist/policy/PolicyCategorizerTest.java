package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyCategorizerTest {

    private final PolicyCategorizer categorizer = new PolicyCategorizer(DefaultPolicyCategories.defaults());

    @Test
    void priorityKeywordsOutweighOrdinaryOnes() {
        PolicyCategorizer.Categorization categorization = categorizer.categorize("怎么用Venmo付款");

        assertEquals("payment", categorization.category());
        assertEquals(PolicyCategorizer.PRIORITY_WEIGHT + PolicyCategorizer.ORDINARY_WEIGHT, categorization.score());
        assertFalse(categorization.isGeneral());
    }

    @Test
    void tieGoesToEarlierDeclaredCategory() {
        PolicyCategorizer.Categorization categorization = categorizer.categorize("配送还是取货");

        assertEquals(1, categorization.scores().get("delivery"));
        assertEquals(1, categorization.scores().get("pickup"));
        assertEquals("pickup", categorization.category());
    }

    @Test
    void noKeywordMeansGeneral() {
        PolicyCategorizer.Categorization categorization = categorizer.categorize("今天天气怎么样");

        assertEquals("general", categorization.category());
        assertTrue(categorization.isGeneral());
    }

    @Test
    void overlapCountsOnlySharedCategoryKeywords() {
        assertEquals(3, categorizer.overlap("payment", "venmo账号", "Venmo 付款请转账至 @coop-fresh"));
        assertEquals(0, categorizer.overlap("pickup", "venmo账号", "Venmo 付款请转账至 @coop-fresh"));
        assertEquals(0, categorizer.overlap("no-such-category", "付款", "付款"));
    }

    @Test
    void priorityKeywordIsNotDoubleCounted() {
        PolicyCategorizer custom = new PolicyCategorizer(List.of(PolicyCategory.builder()
                .name("refund")
                .keywords(List.of("退款", "退钱"))
                .priorityKeywords(List.of("退款"))
                .build()));

        assertEquals(List.of("退钱"), custom.categories().get(0).getKeywords());
        assertEquals(3, custom.categorize("退款").score());
        assertEquals("refund", custom.categories().get(0).getDisplayName());
    }

    @Test
    void reservedDuplicateAndEmptyCategoriesAreRejected() {
        CoopAssistException ex = assertThrows(CoopAssistException.class, () -> new PolicyCategorizer(List.of(
                PolicyCategory.builder().name("general").keywords(List.of("其他")).build(),
                PolicyCategory.builder().name("payment").keywords(List.of("付款")).build(),
                PolicyCategory.builder().name("Payment").keywords(List.of("支付")).build(),
                PolicyCategory.builder().name("pickup").build())));

        assertTrue(ex.is(CoopAssistErrorCode.MALFORMED_POLICY_CORPUS));
        assertTrue(ex.getMessage().contains("reserved"));
        assertTrue(ex.getMessage().contains("duplicate category 'Payment'"));
        assertTrue(ex.getMessage().contains("'pickup' has no keywords"));
    }
}
