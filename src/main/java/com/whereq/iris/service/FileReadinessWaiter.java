package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.exception.FileNotReadyException;
import com.whereq.iris.model.FileReadiness;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Waits for one specific file that an external process is still writing.
 *
 * <p>Waiting blocks, so the reactive variants run on the bounded elastic scheduler.
 */
@Slf4j
@Service
public class FileReadinessWaiter {

    private final int stabilityRounds;

    @Autowired
    public FileReadinessWaiter(IrisProperties properties) {
        this(properties.getPreview().getStabilityRounds());
    }

    FileReadinessWaiter(int stabilityRounds) {
        this.stabilityRounds = stabilityRounds;
    }

    public Mono<FileReadiness> awaitStableFileReactive(Path path, Duration timeout, Duration pollInterval) {
        return Mono.fromCallable(() -> awaitStableFile(path, timeout, pollInterval))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Wait until {@code path} exists, then until its size is non-zero and the same on two
     * consecutive polls.
     *
     * @return {@link FileReadiness#READY} once stable; {@link FileReadiness#EMPTY} if it exists
     * but never grew past zero bytes; {@link FileReadiness#TIMEOUT} if it never appeared, or
     * kept changing, before the deadline or the stability rounds ran out
     */
    public FileReadiness awaitStableFile(Path path, Duration timeout, Duration pollInterval) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMs = pollInterval.toMillis();

        while (!Files.exists(path)) {
            if (System.nanoTime() >= deadline) {
                log.warn("Timeout reached waiting for file: {}", path);
                return FileReadiness.TIMEOUT;
            }
            Thread.sleep(pollMs);
        }

        long previous = -1;
        long size = 0;
        for (int round = 0; round < stabilityRounds; round++) {
            size = sizeOf(path);
            if (size > 0 && size == previous) {
                log.debug("File {} stable at {} bytes", path, size);
                return FileReadiness.READY;
            }
            previous = size;
            if (System.nanoTime() >= deadline) {
                break;
            }
            Thread.sleep(pollMs);
        }

        if (size == 0) {
            log.warn("File created but empty: {}", path);
            return FileReadiness.EMPTY;
        }
        log.warn("File {} still changing after {} polls", path, stabilityRounds);
        return FileReadiness.TIMEOUT;
    }

    /**
     * As {@link #awaitStableFileReactive}, but errors with {@link FileNotReadyException}
     * unless the file became ready.
     */
    public Mono<Path> requireStableFile(Path path, Duration timeout, Duration pollInterval) {
        return awaitStableFileReactive(path, timeout, pollInterval)
                .flatMap(readiness -> readiness == FileReadiness.READY
                        ? Mono.just(path)
                        : Mono.error(new FileNotReadyException(path, readiness, describe(path, readiness, timeout))));
    }

    /**
     * Wait until {@code path} can be read and has non-blank content, returning that content.
     */
    public Mono<String> awaitContent(Path path, Duration timeout, Duration pollInterval) {
        return Mono.fromCallable(() -> {
                    long deadline = System.nanoTime() + timeout.toNanos();
                    while (true) {
                        String content = readQuietly(path);
                        if (!content.isBlank()) {
                            return content.strip();
                        }
                        if (System.nanoTime() >= deadline) {
                            throw new FileNotReadyException(path, FileReadiness.TIMEOUT,
                                    "File content not available within " + timeout.toSeconds() + " seconds: " + path);
                        }
                        Thread.sleep(pollInterval.toMillis());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", path, e.getMessage());
            return 0;
        }
    }

    private String readQuietly(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.trace("File {} not readable yet: {}", path, e.getMessage());
            return "";
        }
    }

    private String describe(Path path, FileReadiness readiness, Duration timeout) {
        return readiness == FileReadiness.EMPTY
                ? "File created but empty: " + path
                : "File not ready within " + timeout.toSeconds() + " seconds: " + path;
    }
}
