package com.github.salilvnair.coopassist.engine.helper;

import com.github.salilvnair.coopassist.engine.model.PendingClarification;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.engine.type.ClarificationKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SelectionParserTest {

    private static final PendingClarification PENDING = new PendingClarification(
            ClarificationKind.PRODUCT,
            List.of(
                    new SelectableOption("土鸡 (约2.5lb/只)", "product_selection:farm-chicken"),
                    new SelectableOption("鸡翅 (2lb/袋)", "product_selection:chicken-wings")),
            Instant.parse("2024-06-01T08:00:00Z"),
            Instant.parse("2024-06-01T08:10:00Z"));

    @Test
    void ordinalsInDigitsAndChinese() {
        assertEquals(2, SelectionParser.ordinal("2"));
        assertEquals(2, SelectionParser.ordinal("第2个"));
        assertEquals(2, SelectionParser.ordinal("第二个"));
        assertEquals(3, SelectionParser.ordinal("三"));
        assertEquals(-1, SelectionParser.ordinal("两斤"));
        assertEquals(-1, SelectionParser.ordinal(null));
    }

    @Test
    void payloadsAreRecognised() {
        assertTrue(SelectionParser.isProductPayload(" product_selection:eggs "));
        assertTrue(SelectionParser.isPolicyPayload("policy_category:pickup"));
        assertFalse(SelectionParser.isPayload("草莓"));
        assertEquals("eggs", SelectionParser.payloadValue("product_selection: eggs"));
    }

    @Test
    void selectByOrdinalOrPayload() {
        assertEquals("product_selection:chicken-wings", SelectionParser.select(PENDING, "2", "2").payload());
        assertEquals("土鸡 (约2.5lb/只)",
                SelectionParser.select(PENDING, "product_selection:farm-chicken", "product_selection:farm-chicken")
                        .displayText());
    }

    @Test
    void outOfRangeOrForeignSelectionsAreNotSelections() {
        assertNull(SelectionParser.select(PENDING, "5", "5"));
        assertNull(SelectionParser.select(PENDING, "product_selection:eggs", "product_selection:eggs"));
        assertNull(SelectionParser.select(PENDING, "草莓", "草莓"));
        assertNull(SelectionParser.select(null, "1", "1"));
    }
}
