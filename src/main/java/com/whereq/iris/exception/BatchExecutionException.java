package com.whereq.iris.exception;

import java.util.List;

/**
 * Exception thrown when a batch as a whole fails. Carries the per-file error log
 * collected before the failure.
 */
public class BatchExecutionException extends RuntimeException {

    private final List<String> errorLog;

    public BatchExecutionException(String message, List<String> errorLog) {
        super(message);
        this.errorLog = List.copyOf(errorLog);
    }

    public BatchExecutionException(String message, List<String> errorLog, Throwable cause) {
        super(message, cause);
        this.errorLog = List.copyOf(errorLog);
    }

    public List<String> getErrorLog() {
        return errorLog;
    }
}
