package com.whereq.iris.exception;

/**
 * Exception thrown when the streaming completion backend rejects a request or breaks mid-stream
 */
public class CompletionBackendException extends RuntimeException {
    public CompletionBackendException(String message) {
        super(message);
    }

    public CompletionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
