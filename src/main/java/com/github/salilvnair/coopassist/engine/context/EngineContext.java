package com.github.salilvnair.coopassist.engine.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class EngineContext {
    private String userId;
    private String message;
    // cache warm-up run: no generative fallback, no lasting session state
    private boolean preheat;
}
