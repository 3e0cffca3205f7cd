package com.whereq.iris.exception;

import java.util.List;

/**
 * Exception thrown when the result archive could not be written or is missing afterwards
 */
public class ArchiveCreationException extends BatchExecutionException {
    public ArchiveCreationException(String message) {
        super(message, List.of());
    }

    public ArchiveCreationException(String message, Throwable cause) {
        super(message, List.of(), cause);
    }

    public ArchiveCreationException(String message, List<String> errorLog, Throwable cause) {
        super(message, errorLog, cause);
    }
}
