package com.github.salilvnair.coopassist.catalog.resolver;

import com.github.salilvnair.coopassist.catalog.ProductCatalog;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.support.CoopAssistFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CategoryGuesserTest {

    private final ProductCatalog catalog = CoopAssistFixtures.catalog();

    @Test
    void categoryNameInFragmentWins() {
        CategoryGuesser guesser = new CategoryGuesser(catalog, new CoopAssistFlowConfig());

        assertEquals(Optional.of("水果"), guesser.guess("什么水果", false));
        assertEquals(Optional.of("海鲜"), guesser.guess("海鲜", true));
    }

    @Test
    void itemWordsPointAtTheirCategory() {
        CategoryGuesser guesser = new CategoryGuesser(catalog, new CoopAssistFlowConfig());

        assertEquals(Optional.of("水果"), guesser.guess("桃子", true));
        assertEquals(Optional.of("禽类"), guesser.guess("鸭", true));
        assertEquals(Optional.of("蔬菜"), guesser.guess("菠菜", true));
        assertEquals(Optional.of("水果"), guesser.guess("西瓜", true));
    }

    @Test
    void itemWordsAreIgnoredWhenNotAskedFor() {
        CategoryGuesser guesser = new CategoryGuesser(catalog, new CoopAssistFlowConfig());

        assertTrue(guesser.guess("桃子", false).isEmpty());
    }

    @Test
    void categoriesMissingFromTheCatalogAreNeverGuessed() {
        CategoryGuesser guesser = new CategoryGuesser(catalog, new CoopAssistFlowConfig());

        assertTrue(guesser.guess("饺子", true).isEmpty());
        assertTrue(guesser.guess("榴莲", true).isEmpty());
        assertTrue(guesser.guess(" ", true).isEmpty());
        assertTrue(guesser.guess(null, true).isEmpty());
    }

    @Test
    void configuredTableReplacesBuiltInOne() {
        CoopAssistFlowConfig flowConfig = new CoopAssistFlowConfig();
        flowConfig.getResolver().getCategoryKeywords().add(entry("海鲜", List.of("鲍鱼", "扇贝")));
        CategoryGuesser guesser = new CategoryGuesser(catalog, flowConfig);

        assertEquals(Optional.of("海鲜"), guesser.guess("扇贝", true));
        assertTrue(guesser.guess("桃子", true).isEmpty());
    }

    @Test
    void entryWithoutKeywordsIsMalformed() {
        CoopAssistFlowConfig flowConfig = new CoopAssistFlowConfig();
        flowConfig.getResolver().getCategoryKeywords().add(entry("海鲜", List.of(" ")));

        CoopAssistException ex = assertThrows(CoopAssistException.class, () -> new CategoryGuesser(catalog, flowConfig));

        assertTrue(ex.is(CoopAssistErrorCode.MALFORMED_RULE_TABLE));
    }

    private static CoopAssistFlowConfig.CategoryKeywords entry(String category, List<String> keywords) {
        CoopAssistFlowConfig.CategoryKeywords entry = new CoopAssistFlowConfig.CategoryKeywords();
        entry.setCategory(category);
        entry.setKeywords(new ArrayList<>(keywords));
        return entry;
    }
}
