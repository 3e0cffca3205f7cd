package com.whereq.iris.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of a batch that produced at least one output.
 */
@Value
@Builder
public class BatchResult {

    Archive archive;

    /**
     * One entry per file that failed, keyed by filename in the message
     */
    @Singular("error")
    List<String> errorLog;

    @Singular
    List<ExecutionRecord> records;
}
