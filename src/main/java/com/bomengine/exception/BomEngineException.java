package com.bomengine.exception;

import lombok.Getter;

@Getter
public abstract class BomEngineException extends RuntimeException {
    private final String errorCode;
    protected BomEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected BomEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
