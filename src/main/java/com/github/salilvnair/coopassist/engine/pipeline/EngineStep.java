package com.github.salilvnair.coopassist.engine.pipeline;

import com.github.salilvnair.coopassist.engine.session.EngineSession;

public interface EngineStep {
    StepResult execute(EngineSession session);
}
