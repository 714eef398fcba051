package com.github.salilvnair.coopassist.engine.pipeline;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.session.EngineSession;

import java.util.List;

public final class EnginePipeline {

    private final List<EngineStep> steps;

    public EnginePipeline(List<EngineStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public EngineResult execute(EngineSession session) {
        for (EngineStep step : steps) {
            StepResult r = step.execute(session);
            if (r instanceof StepResult.Stop stop) {
                return stop.result();
            }
        }
        // PipelineEndGuardStep must have set finalResult
        if (session.getFinalResult() == null) {
            throw new CoopAssistException(CoopAssistErrorCode.PIPELINE_NO_FINAL_RESULT);
        }
        return session.getFinalResult();
    }

    public List<EngineStep> steps() {
        return steps;
    }
}
