package com.github.salilvnair.coopassist.policy;

import java.util.Map;

public record PolicySentence(
        int id,
        String section,
        String content,
        String normalized,
        String category,
        Map<String, Integer> categoryScores
) {}
