package com.github.salilvnair.coopassist.engine.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FillerStripperTest {

    private final FillerStripper stripper = FillerStripper.defaults();

    @Test
    void stripRemovesAvailabilitySuffixAndPunctuation() {
        assertEquals("草莓", stripper.strip(TextNormalizer.normalize("草莓卖不？")));
        assertEquals("鸡", stripper.strip("鸡有吗"));
    }

    @Test
    void stripRemovesPrefixesAndPricePhrases() {
        assertEquals("草莓", stripper.strip("请问你们有没有草莓"));
        assertEquals("走地鸡", stripper.strip("走地鸡多少钱"));
        assertEquals("蓝莓", stripper.strip("我想买蓝莓"));
    }

    @Test
    void stripKeepsWordsThatOnlyLookLikeFiller() {
        assertEquals("有机菜", stripper.strip("有机菜"));
    }

    @Test
    void customRulesRunInTableOrder() {
        FillerStripper custom = new FillerStripper(List.of(
                new FillerStripper.FillerRule("please", Pattern.compile("^please "), ""),
                new FillerStripper.FillerRule("question", Pattern.compile("\\?$"), "")));

        assertEquals("eggs", custom.strip("please eggs?"));
    }
}
