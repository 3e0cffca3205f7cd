package com.whereq.iris.model;

import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * An uploaded file that has not yet been written to the working directory.
 */
public interface UploadedImage {

    /**
     * Filename as sent by the client, may be null or contain path segments
     */
    String filename();

    /**
     * Write the content to {@code destination}.
     */
    Mono<Void> transferTo(Path destination);
}
