package com.whereq.iris.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of running the macro against one {@link Job}.
 */
@Value
@Builder
public class ExecutionRecord {

    Job job;

    /**
     * Raw text returned by the engine (or its log when the direct return was empty)
     */
    String log;

    @Singular
    List<Path> outputs;

    /**
     * Error message, null when the invocation succeeded
     */
    String error;

    public boolean isFailed() {
        return error != null;
    }

    public boolean hasOutputs() {
        return !outputs.isEmpty();
    }
}
