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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes the classified message to its tiered handler. A handler that cannot answer leaves the session without a
 * final result and the generative fallback takes over.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(IntentResolutionStep.class)
public class IntentDispatchStep implements EngineStep {

    private final ProductInquiryService productInquiry;
    private final PolicyInquiryService policyInquiry;

    @Override
    public StepResult execute(EngineSession session) {
        IntentClassification classification = session.getClassification();
        Intent intent = classification.intent();
        ClassificationTier tier = classification.tier();
        boolean answered = switch (intent) {
            case GREETING -> reply(session, ReplyConstants.GREETING, intent, tier);
            case IDENTITY_QUERY -> reply(session, ReplyConstants.IDENTITY, intent, tier);
            case WHAT_DO_YOU_SELL -> complete(session, productInquiry.catalogOverview(tier));
            case REQUEST_RECOMMENDATION -> complete(session, productInquiry.recommendation(tier));
            case INQUIRY_AVAILABILITY, INQUIRY_PRICE_OR_BUY -> productInquiry.answer(session, intent, tier, true);
            case INQUIRY_POLICY -> policyInquiry.answer(session, tier);
            case REFUND_REQUEST -> policyInquiry.refund(session, tier);
            // a bare product name classifies as nothing; try the catalog before the generative model
            case UNKNOWN -> productInquiry.answer(session, intent, tier, false);
        };
        log.debug("Co-op Assist: {} via {} answered={} user={}", intent, tier, answered, session.getUserId());
        return new StepResult.Continue();
    }

    private boolean reply(EngineSession session, String text, Intent intent, ClassificationTier tier) {
        return complete(session, EngineResult.text(text, intent, tier, AnswerSource.RULE_REPLY));
    }

    private boolean complete(EngineSession session, EngineResult result) {
        session.complete(result, true);
        return true;
    }
}
