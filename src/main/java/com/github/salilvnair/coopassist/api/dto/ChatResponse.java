package com.github.salilvnair.coopassist.api.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ChatResponse {

    private String userId;
    private String message;
    private List<ApiOption> options = new ArrayList<>();
    private String intent;
    private String tier;
    private String source;
    private boolean cached;

    public record ApiOption(String text, String payload) {}
}
