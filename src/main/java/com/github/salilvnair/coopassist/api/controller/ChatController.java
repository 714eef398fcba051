package com.github.salilvnair.coopassist.api.controller;

import com.github.salilvnair.coopassist.api.dto.ChatRequest;
import com.github.salilvnair.coopassist.api.dto.ChatResponse;
import com.github.salilvnair.coopassist.engine.context.EngineContext;
import com.github.salilvnair.coopassist.engine.core.ConversationalEngine;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ConversationalEngine engine;

    @PostMapping("/message")
    public ChatResponse message(@RequestBody ChatRequest request) {
        EngineContext engineContext = EngineContext.builder()
                .userId(request.getUserId())
                .message(request.getMessage())
                .build();

        EngineResult result = engine.process(engineContext);

        ChatResponse res = new ChatResponse();
        res.setUserId(engineContext.getUserId());
        res.setMessage(result.responseText());
        result.options().forEach(o -> res.getOptions().add(new ChatResponse.ApiOption(o.displayText(), o.payload())));
        res.setIntent(result.intent() == null ? null : result.intent().code());
        res.setTier(result.tier() == null ? null : result.tier().name());
        res.setSource(result.source() == null ? null : result.source().name());
        res.setCached(result.fromCache());
        return res;
    }
}
