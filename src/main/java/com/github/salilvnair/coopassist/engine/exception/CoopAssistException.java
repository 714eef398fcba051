package com.github.salilvnair.coopassist.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class CoopAssistException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public CoopAssistException(CoopAssistErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public CoopAssistException(CoopAssistErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public CoopAssistException(CoopAssistErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public CoopAssistException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean is(CoopAssistErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}
