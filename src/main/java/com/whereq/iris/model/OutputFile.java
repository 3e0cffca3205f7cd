package com.whereq.iris.model;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.nio.file.Path;

/**
 * A produced file that existed with a non-zero size when it was discovered.
 * Identity is the canonical path only, so the same file found by both
 * discovery strategies collapses into one entry.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OutputFile {

    @EqualsAndHashCode.Include
    Path path;

    long size;

    Provenance provenance;

    public enum Provenance {
        /**
         * Announced by the macro through an output marker log line
         */
        DECLARED,

        /**
         * Found by scanning the working directory for the image's name stem
         */
        DISCOVERED
    }
}
