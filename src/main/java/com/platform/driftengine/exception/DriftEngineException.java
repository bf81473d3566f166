package com.platform.driftengine.exception;

/**
 * Base of all engine failures. {@code errorCode} is stable and safe to expose over the API.
 */
public abstract class DriftEngineException extends RuntimeException {

    private final String errorCode;

    protected DriftEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DriftEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
