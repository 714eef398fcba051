package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.type.RetrievalTier;

import java.util.List;

public record PolicySearchResult(
        String query,
        String categoryGuess,
        List<RankedSentence> sentences,
        List<RetrievalTier> tiersInvoked
) {
    public PolicySearchResult {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        tiersInvoked = tiersInvoked == null ? List.of() : List.copyOf(tiersInvoked);
    }

    public boolean isEmpty() {
        return sentences.isEmpty();
    }

    public boolean invoked(RetrievalTier tier) {
        return tiersInvoked.contains(tier);
    }

    public List<String> contents() {
        return sentences.stream().map(RankedSentence::content).toList();
    }
}
