package com.whereq.iris.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * One uploaded image inside a batch.
 */
@Value
@Builder(toBuilder = true)
public class Job {

    /**
     * Filename as sent by the client
     */
    String originalFilename;

    /**
     * Sanitized and, if needed, disambiguated filename the image is stored under
     */
    String filename;

    /**
     * {@link #filename} without extension; outputs are discovered by this prefix
     */
    String nameStem;

    Path inputPath;

    /**
     * Batch working directory shared by every job of the batch
     */
    Path workingDir;

    JobParameters parameters;
}
