package com.whereq.iris.exception;

import com.whereq.iris.model.FileReadiness;

import java.nio.file.Path;

/**
 * Exception thrown when an awaited artifact timed out or stayed empty
 */
public class FileNotReadyException extends RuntimeException {

    private final Path path;
    private final FileReadiness readiness;

    public FileNotReadyException(Path path, FileReadiness readiness, String message) {
        super(message);
        this.path = path;
        this.readiness = readiness;
    }

    public Path getPath() {
        return path;
    }

    public FileReadiness getReadiness() {
        return readiness;
    }

    public boolean isTimeout() {
        return readiness == FileReadiness.TIMEOUT;
    }
}
