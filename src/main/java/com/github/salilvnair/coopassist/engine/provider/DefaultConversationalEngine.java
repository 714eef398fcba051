package com.github.salilvnair.coopassist.engine.provider;

import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.context.EngineContext;
import com.github.salilvnair.coopassist.engine.core.ConversationalEngine;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.factory.EnginePipelineFactory;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs a message through the step pipeline. Whatever fails inside, the caller gets a crafted reply, never an
 * exception or its text.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultConversationalEngine implements ConversationalEngine {

    static final String ANONYMOUS_USER = "anonymous";

    private final EnginePipelineFactory pipelineFactory;

    @Override
    public EngineResult process(EngineContext engineContext) {
        if (engineContext.getUserId() == null || engineContext.getUserId().isBlank()) {
            engineContext.setUserId(ANONYMOUS_USER);
        }
        EngineSession session = new EngineSession(engineContext);
        try {
            return pipelineFactory.create().execute(session);
        } catch (CoopAssistException ex) {
            log.warn("Co-op Assist: request of user={} failed, code={} recoverable={} message={}",
                    engineContext.getUserId(), ex.getErrorCode(), ex.isRecoverable(), ex.getMessage());
            return apology();
        } catch (Exception ex) {
            log.error("Co-op Assist: unexpected failure for user={}", engineContext.getUserId(), ex);
            return apology();
        }
    }

    private EngineResult apology() {
        return EngineResult.text(ReplyConstants.FALLBACK_APOLOGY,
                Intent.UNKNOWN, ClassificationTier.NONE, AnswerSource.CANNED_FALLBACK);
    }
}
