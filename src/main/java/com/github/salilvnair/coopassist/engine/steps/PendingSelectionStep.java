package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.helper.SelectionParser;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.PendingClarification;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.service.PolicyInquiryService;
import com.github.salilvnair.coopassist.engine.service.ProductInquiryService;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.session.DialogueSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Answers a choice among previously offered options. Button payloads resolve even when the clarification that
 * offered them is gone; typed ordinals only count while a clarification is pending. Any other message drops the
 * pending clarification and continues as a fresh question.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(NormalizeInputStep.class)
public class PendingSelectionStep implements EngineStep {

    private final DialogueSessionManager sessions;
    private final ProductInquiryService productInquiry;
    private final PolicyInquiryService policyInquiry;

    @Override
    public StepResult execute(EngineSession session) {
        if (session.isPreheat()) {
            return new StepResult.Continue();
        }
        String userId = session.getUserId();
        String raw = session.getRawMessage();
        Optional<PendingClarification> pending = sessions.getPending(userId);

        SelectableOption chosen = SelectionParser.select(pending.orElse(null), raw, session.getUtterance().normalized());
        if (chosen != null) {
            sessions.clearPending(userId);
            log.debug("Co-op Assist: user={} selected '{}'", userId, chosen.displayText());
            return resolve(session, chosen.payload());
        }
        if (SelectionParser.isPayload(raw)) {
            pending.ifPresent(p -> sessions.clearPending(userId));
            return resolve(session, raw.trim());
        }
        if (pending.isPresent()) {
            log.debug("Co-op Assist: user={} moved on, clearing pending {} clarification", userId, pending.get().kind());
            sessions.clearPending(userId);
        }
        return new StepResult.Continue();
    }

    private StepResult resolve(EngineSession session, String payload) {
        String value = SelectionParser.payloadValue(payload);
        Optional<EngineResult> answer = SelectionParser.isProductPayload(payload)
                ? productInquiry.select(session, value)
                : policyInquiry.selectCategory(value);
        EngineResult result = answer.orElseGet(() -> EngineResult.text(ReplyConstants.SELECTION_EXPIRED,
                Intent.UNKNOWN, ClassificationTier.NONE, AnswerSource.SELECTION));
        session.complete(result, false);
        return new StepResult.Stop(result);
    }
}
