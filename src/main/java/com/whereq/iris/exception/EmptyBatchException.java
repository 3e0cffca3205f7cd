package com.whereq.iris.exception;

/**
 * Exception thrown when a batch request carries no files
 */
public class EmptyBatchException extends IllegalArgumentException {
    public EmptyBatchException() {
        super("No files uploaded");
    }
}
