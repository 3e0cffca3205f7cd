package com.whereq.iris.service;

import com.whereq.iris.exception.FileNotReadyException;
import com.whereq.iris.model.FileReadiness;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileReadinessWaiterTest {

    private static final Duration POLL = Duration.ofMillis(20);

    @TempDir
    Path dir;

    private final FileReadinessWaiter waiter = new FileReadinessWaiter(10);

    @Test
    void awaitStableFile_readyOnceSizeStopsChanging() throws Exception {
        Path file = Files.writeString(dir.resolve("preview.png"), "png-bytes");

        assertEquals(FileReadiness.READY, waiter.awaitStableFile(file, Duration.ofSeconds(2), POLL));
    }

    @Test
    void awaitStableFile_readyOnlyAfterGrowthStops() throws Exception {
        Path file = Files.writeString(dir.resolve("growing.png"), "p");
        AtomicLong lastWrite = new AtomicLong();
        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 40; i++) {
                append(file);
                lastWrite.set(System.nanoTime());
                pause(5);
            }
        });

        FileReadiness readiness = new FileReadinessWaiter(30).awaitStableFile(file, Duration.ofSeconds(10), Duration.ofMillis(100));
        long readyAt = System.nanoTime();

        assertEquals(FileReadiness.READY, readiness);
        assertTrue(writer.isDone());
        assertTrue(readyAt > lastWrite.get());
        assertEquals(41, Files.size(file));
    }

    @Test
    void awaitStableFile_timesOutWhileFileKeepsGrowing() throws Exception {
        Path file = Files.writeString(dir.resolve("growing.png"), "p");
        AtomicBoolean writing = new AtomicBoolean(true);
        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            while (writing.get()) {
                append(file);
                pause(5);
            }
        });

        try {
            FileReadiness readiness = new FileReadinessWaiter(4).awaitStableFile(file, Duration.ofSeconds(10), Duration.ofMillis(50));

            assertEquals(FileReadiness.TIMEOUT, readiness);
            assertTrue(Files.size(file) > 1);
        } finally {
            writing.set(false);
            writer.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void awaitStableFile_waitsForFileToAppear() throws Exception {
        Path file = dir.resolve("late.png");
        CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(100);
                Files.writeString(file, "arrived");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        assertEquals(FileReadiness.READY, waiter.awaitStableFile(file, Duration.ofSeconds(5), POLL));
    }

    @Test
    void awaitStableFile_timesOutWhenFileNeverAppears() throws Exception {
        long start = System.nanoTime();

        FileReadiness readiness = waiter.awaitStableFile(dir.resolve("missing.png"), Duration.ofMillis(150), POLL);

        assertEquals(FileReadiness.TIMEOUT, readiness);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 150);
    }

    @Test
    void awaitStableFile_reportsEmptyFile() throws Exception {
        Path file = Files.createFile(dir.resolve("empty.png"));

        assertEquals(FileReadiness.EMPTY, waiter.awaitStableFile(file, Duration.ofSeconds(2), POLL));
    }

    @Test
    void requireStableFile_failsWithReadiness() {
        Path missing = dir.resolve("missing.png");

        StepVerifier.create(waiter.requireStableFile(missing, Duration.ofMillis(100), POLL))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof FileNotReadyException);
                    assertTrue(((FileNotReadyException) e).isTimeout());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void awaitContent_returnsStrippedContent() throws Exception {
        Path log = Files.writeString(dir.resolve("output_log.txt"), "\nPREVIEW_PATH: /tmp/a.png\n");

        StepVerifier.create(waiter.awaitContent(log, Duration.ofSeconds(1), POLL))
                .expectNext("PREVIEW_PATH: /tmp/a.png")
                .verifyComplete();
    }

    @Test
    void awaitContent_timesOutOnBlankFile() throws Exception {
        Path log = Files.writeString(dir.resolve("output_log.txt"), "   ");

        StepVerifier.create(waiter.awaitContent(log, Duration.ofMillis(100), POLL))
                .expectError(FileNotReadyException.class)
                .verify(Duration.ofSeconds(5));
    }

    private static void append(Path file) {
        try {
            Files.writeString(file, "x", StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
