package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.session.DialogueSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class NormalizeInputStep implements EngineStep {

    private final DialogueSessionManager sessions;

    @Override
    public StepResult execute(EngineSession session) {
        String raw = session.getRawMessage() == null ? "" : session.getRawMessage();
        Utterance utterance = new Utterance(raw, TextNormalizer.normalize(raw));
        session.setUtterance(utterance);
        if (!session.isPreheat()) {
            sessions.touch(session.getUserId());
        }
        if (utterance.isBlank()) {
            EngineResult result = EngineResult.text(ReplyConstants.EMPTY_INPUT,
                    Intent.UNKNOWN, ClassificationTier.NONE, AnswerSource.CANNED_FALLBACK);
            session.complete(result, false);
            return new StepResult.Stop(result);
        }
        return new StepResult.Continue();
    }
}
