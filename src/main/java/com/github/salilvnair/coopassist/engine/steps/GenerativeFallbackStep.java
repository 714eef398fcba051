package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.service.PolicyInquiryService;
import com.github.salilvnair.coopassist.engine.service.ProductInquiryService;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.llm.GenerativeFallbackService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(CacheWriteStep.class)
public class GenerativeFallbackStep implements EngineStep {

    private final GenerativeFallbackService fallbackService;
    private final PolicyInquiryService policyInquiry;
    private final ProductInquiryService productInquiry;

    @Override
    public StepResult execute(EngineSession session) {
        if (session.hasFinalResult() || session.isPreheat()) {
            return new StepResult.Continue();
        }
        IntentClassification classification = session.getClassification();
        Intent intent = classification == null ? Intent.UNKNOWN : classification.intent();
        ClassificationTier tier = classification == null ? ClassificationTier.NONE : classification.tier();

        List<String> hints = new ArrayList<>(session.getFallbackHints());
        if (hints.isEmpty()) {
            hints.addAll(policyInquiry.policyHints());
        }
        hints.addAll(productInquiry.catalogHints());

        Optional<String> generated = fallbackService.generate(session.getRawMessage(), hints);
        EngineResult result = generated
                .map(text -> EngineResult.text(text, intent, tier, AnswerSource.GENERATIVE))
                .orElseGet(() -> EngineResult.text(ReplyConstants.FALLBACK_APOLOGY, intent, tier, AnswerSource.CANNED_FALLBACK));
        log.debug("Co-op Assist: fallback for user={} intent={} source={}", session.getUserId(), intent, result.source());
        session.complete(result, false);
        return new StepResult.Continue();
    }
}
