package com.whereq.iris.controller;

import com.whereq.iris.model.UploadedImage;
import org.springframework.http.codec.multipart.FilePart;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * {@link UploadedImage} backed by a multipart file part.
 */
class FilePartImage implements UploadedImage {

    private final FilePart part;

    FilePartImage(FilePart part) {
        this.part = part;
    }

    @Override
    public String filename() {
        return part.filename();
    }

    @Override
    public Mono<Void> transferTo(Path destination) {
        return part.transferTo(destination);
    }
}
