package com.github.salilvnair.coopassist.api.dto;

import lombok.Data;

@Data
public class ChatRequest {

    private String userId;
    private String message;
}
