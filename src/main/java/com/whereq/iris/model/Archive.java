package com.whereq.iris.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * The zip packaged from a batch's outputs. Immutable once written.
 */
@Value
public class Archive {

    Path path;

    long size;

    /**
     * Entry names in the order they were written
     */
    List<String> members;
}
