package com.whereq.iris.exception;

/**
 * Exception thrown when a single macro invocation fails, times out or exits non-zero
 */
public class MacroExecutionException extends RuntimeException {
    public MacroExecutionException(String message) {
        super(message);
    }

    public MacroExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
