package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.type.RetrievalTier;

public record RankedSentence(
        PolicySentence sentence,
        double score,
        RetrievalTier tier
) {
    public String content() {
        return sentence.content();
    }
}
