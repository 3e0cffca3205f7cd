package com.whereq.iris.exception;

import java.util.List;

/**
 * Exception thrown when no job of a batch produced a single output file
 */
public class NoOutputsProducedException extends BatchExecutionException {
    public NoOutputsProducedException(List<String> errorLog) {
        super("No output files were generated.", errorLog);
    }
}
