package com.platform.driftengine.exception;

public class BaselineStoreException extends DriftEngineException {

    public BaselineStoreException(String message, Throwable cause) {
        super("BASELINE_STORE_ERROR", message, cause);
    }
}
