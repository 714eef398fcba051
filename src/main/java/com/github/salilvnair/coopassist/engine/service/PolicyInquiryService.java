package com.github.salilvnair.coopassist.engine.service;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.constants.SelectionConstants;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.engine.response.ReplyComposer;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClarificationKind;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.policy.PolicyCategory;
import com.github.salilvnair.coopassist.policy.PolicyRetrievalEngine;
import com.github.salilvnair.coopassist.policy.PolicySearchResult;
import com.github.salilvnair.coopassist.session.DialogueSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Component
public class PolicyInquiryService {

    private static final String REFUND_CATEGORY = "refund";
    private static final String GENERIC_TOPIC = "我们的政策";

    private final PolicyRetrievalEngine retrievalEngine;
    private final DialogueSessionManager sessions;
    private final ReplyComposer replies;
    private final CoopAssistFlowConfig flowConfig;

    /**
     * @return true when the session was completed; false leaves the question to the generative fallback
     */
    public boolean answer(EngineSession session, ClassificationTier tier) {
        PolicySearchResult result = retrievalEngine.search(session.getUtterance().normalized());
        session.setPolicyResult(result);
        if (!result.isEmpty()) {
            String topic = topicOf(result.categoryGuess());
            session.complete(EngineResult.text(replies.policyAnswer(topic, result.sentences()),
                    Intent.INQUIRY_POLICY, tier, AnswerSource.POLICY), true);
            return true;
        }
        if (SelectionConstants.GENERAL_POLICY_CATEGORY.equals(result.categoryGuess())) {
            List<SelectableOption> options = categoryOptions();
            if (!options.isEmpty()) {
                if (!session.isPreheat()) {
                    sessions.setPending(session.getUserId(), ClarificationKind.POLICY_CATEGORY, options);
                }
                session.complete(new EngineResult(replies.clarifyPolicy(options), options,
                        Intent.INQUIRY_POLICY, tier, AnswerSource.POLICY, null, false), false);
                return true;
            }
        }
        session.getFallbackHints().addAll(retrievalEngine.contextHints(flowConfig.getFallback().getMaxHintSentences()));
        return false;
    }

    public boolean refund(EngineSession session, ClassificationTier tier) {
        PolicySearchResult result = retrievalEngine.browseCategory(REFUND_CATEGORY);
        session.setPolicyResult(result);
        if (result.isEmpty()) {
            session.getFallbackHints().addAll(retrievalEngine.contextHints(flowConfig.getFallback().getMaxHintSentences()));
            return false;
        }
        session.complete(EngineResult.text(replies.refundAnswer(result.sentences()),
                Intent.REFUND_REQUEST, tier, AnswerSource.POLICY), true);
        return true;
    }

    public Optional<EngineResult> selectCategory(String category) {
        PolicySearchResult result = retrievalEngine.browseCategory(category);
        if (result.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(EngineResult.text(replies.policyAnswer(topicOf(category), result.sentences()),
                Intent.INQUIRY_POLICY, ClassificationTier.NONE, AnswerSource.SELECTION));
    }

    public List<String> policyHints() {
        return retrievalEngine.contextHints(flowConfig.getFallback().getMaxHintSentences());
    }

    private List<SelectableOption> categoryOptions() {
        return retrievalEngine.browsableCategories().stream()
                .map(c -> new SelectableOption(c.getDisplayName(), SelectionConstants.POLICY_CATEGORY_PREFIX + c.getName()))
                .toList();
    }

    private String topicOf(String category) {
        return retrievalEngine.corpus().getCategorizer().find(category)
                .map(PolicyCategory::getDisplayName)
                .orElse(GENERIC_TOPIC);
    }
}
