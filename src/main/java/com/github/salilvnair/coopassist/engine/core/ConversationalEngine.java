package com.github.salilvnair.coopassist.engine.core;

import com.github.salilvnair.coopassist.engine.context.EngineContext;
import com.github.salilvnair.coopassist.engine.model.EngineResult;

public interface ConversationalEngine {
    EngineResult process(EngineContext engineContext);
}
