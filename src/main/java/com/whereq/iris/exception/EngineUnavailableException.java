package com.whereq.iris.exception;

/**
 * Exception thrown when the macro engine is not initialized or already disposed
 */
public class EngineUnavailableException extends RuntimeException {
    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
