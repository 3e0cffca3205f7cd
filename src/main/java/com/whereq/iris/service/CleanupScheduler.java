package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deletes temporary files and directories later, independent of the request that created them.
 *
 * <p>Callers only post a cleanup request onto a queue; a background consumer waits out each
 * request's delay and deletes the path on the bounded elastic scheduler. Paths still pending
 * at shutdown are deleted synchronously.
 */
@Slf4j
@Service
public class CleanupScheduler {

    private final Duration defaultDelay;
    private final Scheduler timer;
    private final Sinks.Many<CleanupRequest> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Set<Path> pending = ConcurrentHashMap.newKeySet();
    private Disposable consumer;

    @Autowired
    public CleanupScheduler(IrisProperties properties) {
        this(properties.getWorkspace().getCleanupDelay(), Schedulers.parallel());
    }

    CleanupScheduler(Duration defaultDelay, Scheduler timer) {
        this.defaultDelay = defaultDelay;
        this.timer = timer;
    }

    @PostConstruct
    public void start() {
        log.info("Starting cleanup consumer (default delay: {})", defaultDelay);

        consumer = queue.asFlux()
            .flatMap(request -> Mono.delay(request.getDelay(), timer)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(tick -> release(request.getPath()))
                .onErrorResume(e -> {
                    log.error("Cleanup failed for {}: {}", request.getPath(), e.getMessage(), e);
                    return Mono.empty();
                }), Integer.MAX_VALUE)
            .subscribe();
    }

    /**
     * Delete {@code path} after the configured default delay.
     */
    public void schedule(Path path) {
        schedule(path, defaultDelay);
    }

    public void schedule(Path path, Duration delay) {
        if (path == null) {
            return;
        }
        pending.add(path);
        queue.emitNext(new CleanupRequest(path, delay), Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
        log.debug("Scheduled cleanup of {} in {}", path, delay);
    }

    /**
     * Delete {@code path} as soon as {@code response} has terminated, whether it completed,
     * failed or was cancelled by the client.
     */
    public <T> Flux<T> releaseAfter(Flux<T> response, Path path) {
        return response.doFinally(signal -> schedule(path, Duration.ZERO));
    }

    public int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down cleanup consumer, {} path(s) pending", pending.size());
        if (consumer != null) {
            consumer.dispose();
        }
        queue.tryEmitComplete();
        for (Path path : Set.copyOf(pending)) {
            release(path);
        }
    }

    void release(Path path) {
        pending.remove(path);
        try {
            if (Files.isDirectory(path)) {
                deleteTree(path);
                log.info("Removed temporary directory: {}", path);
            } else if (Files.deleteIfExists(path)) {
                log.info("Removed temporary file: {}", path);
            } else {
                log.debug("Path already released: {}", path);
            }
        } catch (IOException e) {
            log.error("Cleanup failed for {}: {}", path, e.getMessage(), e);
        }
    }

    private void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Value
    static class CleanupRequest {
        Path path;
        Duration delay;
    }
}
