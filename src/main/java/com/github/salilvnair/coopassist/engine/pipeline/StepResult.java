package com.github.salilvnair.coopassist.engine.pipeline;

import com.github.salilvnair.coopassist.engine.model.EngineResult;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(EngineResult result) implements StepResult {}
}
