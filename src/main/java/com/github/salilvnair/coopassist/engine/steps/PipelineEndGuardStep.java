package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@TerminalStep
public class PipelineEndGuardStep implements EngineStep {

    @Override
    public StepResult execute(EngineSession session) {
        if (!session.hasFinalResult()) {
            // only reachable on preheat runs, which skip the generative fallback
            session.complete(EngineResult.text(ReplyConstants.FALLBACK_APOLOGY,
                    Intent.UNKNOWN, ClassificationTier.NONE, AnswerSource.CANNED_FALLBACK), false);
        }
        EngineResult result = session.getFinalResult();
        log.debug("Co-op Assist: user={} answered intent={} tier={} source={}",
                session.getUserId(), result.intent(), result.tier(), result.source());
        return new StepResult.Continue();
    }
}
