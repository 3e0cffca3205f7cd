package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.engine.MacroEngine;
import com.whereq.iris.exception.EmptyBatchException;
import com.whereq.iris.exception.EngineUnavailableException;
import com.whereq.iris.exception.MacroExecutionException;
import com.whereq.iris.exception.NoOutputsProducedException;
import com.whereq.iris.model.BatchResult;
import com.whereq.iris.model.JobParameters;
import com.whereq.iris.model.MacroInvocation;
import com.whereq.iris.model.UploadedImage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MacroOrchestratorTest {

    private static final Pattern STEM = Pattern.compile("var originalFileName = \"([^\"]*)\";");
    private static final Pattern IMAGES_DIR = Pattern.compile("var imagesDir = \"([^\"]*)\";");

    @TempDir
    Path root;

    private MacroEngine engine;
    private CleanupScheduler cleanupScheduler;
    private SimpleMeterRegistry meterRegistry;
    private MacroOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        IrisProperties properties = new IrisProperties();
        properties.getWorkspace().setRoot(root.toString());

        engine = mock(MacroEngine.class);
        when(engine.isReady()).thenReturn(true);
        cleanupScheduler = mock(CleanupScheduler.class);
        meterRegistry = new SimpleMeterRegistry();

        orchestrator = new MacroOrchestrator(
                engine,
                new MacroScriptRenderer(new DefaultResourceLoader(), properties),
                new OutputCollector(properties),
                new ArchiveBuilder(),
                cleanupScheduler,
                properties,
                meterRegistry);
    }

    @Test
    void execute_isolatesFailingFile() throws Exception {
        when(engine.runMacro(anyString())).thenAnswer(invocation -> {
            String script = invocation.getArgument(0);
            String stem = group(STEM, script);
            if (stem.equals("b")) {
                throw new MacroExecutionException("Macro failed with exit code: 1");
            }
            Path mask = Paths.get(group(IMAGES_DIR, script) + stem + "_mask.tif");
            Files.writeString(mask, "mask of " + stem);
            return MacroInvocation.of("OUTPUT_FILE: " + mask, "");
        });

        BatchResult result = orchestrator.execute(
                List.of(image("a.tif"), image("b.tif"), image("c.tif")), "run(\"Invert\");", null).block();

        assertEquals(List.of("Images/a_mask.tif", "Images/c_mask.tif"), result.getArchive().getMembers());
        assertEquals(1, result.getErrorLog().size());
        assertTrue(result.getErrorLog().get(0).startsWith("Error processing b.tif:"));
        assertEquals(3, result.getRecords().size());
        assertEquals(1.0, meterRegistry.counter("iris.jobs.failed").count());
        assertEquals(1.0, meterRegistry.counter("iris.batches.succeeded").count());
        verify(engine, times(3)).runMacro(anyString());
        verify(cleanupScheduler).schedule(result.getArchive().getPath().getParent());
    }

    @Test
    void execute_fallsBackToEngineLogWhenOutputIsEmpty() throws Exception {
        when(engine.runMacro(anyString())).thenAnswer(invocation -> {
            String script = invocation.getArgument(0);
            Path stats = Paths.get(group(IMAGES_DIR, script).replace("Images/", "Statistics/") + "summary.csv");
            Files.writeString(stats, "count\n12");
            return MacroInvocation.of("", "OUTPUT_FILE: " + stats);
        });

        BatchResult result = orchestrator.execute(List.of(image("a.tif")), "", JobParameters.defaults()).block();

        assertEquals(List.of("Statistics/summary.csv"), result.getArchive().getMembers());
    }

    @Test
    void execute_failsWhenNothingWasProduced() {
        when(engine.runMacro(anyString())).thenThrow(new MacroExecutionException("boom"));

        StepVerifier.create(orchestrator.execute(List.of(image("a.tif"), image("b.tif")), "", null))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof NoOutputsProducedException);
                    assertEquals(2, ((NoOutputsProducedException) e).getErrorLog().size());
                })
                .verify();

        verify(cleanupScheduler).schedule(any(Path.class));
        assertEquals(1.0, meterRegistry.counter("iris.batches.failed").count());
    }

    @Test
    void execute_inputImagesAreNeverOutputs() {
        when(engine.runMacro(anyString())).thenReturn(MacroInvocation.of("done", ""));

        StepVerifier.create(orchestrator.execute(List.of(image("a.tif")), "", null))
                .expectError(NoOutputsProducedException.class)
                .verify();
    }

    @Test
    void execute_rejectsEmptyBatch() {
        StepVerifier.create(orchestrator.execute(List.of(), "", null))
                .expectError(EmptyBatchException.class)
                .verify();

        verify(engine, never()).runMacro(anyString());
        verify(cleanupScheduler, never()).schedule(any(Path.class));
    }

    @Test
    void execute_rejectsBatchWhileEngineUnavailable() {
        when(engine.isReady()).thenReturn(false);

        StepVerifier.create(orchestrator.execute(List.of(image("a.tif")), "", null))
                .expectError(EngineUnavailableException.class)
                .verify();
    }

    @Test
    void execute_keepsRunningAfterSubscriberCancels() {
        when(engine.runMacro(anyString())).thenAnswer(invocation -> {
            Thread.sleep(50);
            return MacroInvocation.of("", "");
        });

        Disposable subscription = orchestrator.execute(
                List.of(image("a.tif"), image("b.tif"), image("c.tif")), "", null).subscribe(r -> { }, e -> { });
        subscription.dispose();

        verify(engine, timeout(5000).times(3)).runMacro(anyString());
        verify(cleanupScheduler, timeout(5000)).schedule(any(Path.class));
    }

    @Test
    void execute_disambiguatesDuplicateFilenames() throws Exception {
        when(engine.runMacro(anyString())).thenAnswer(invocation -> {
            String script = invocation.getArgument(0);
            String stem = group(STEM, script);
            Path mask = Paths.get(group(IMAGES_DIR, script) + stem + "_mask.tif");
            Files.writeString(mask, stem);
            return MacroInvocation.of("OUTPUT_FILE: " + mask, "");
        });

        BatchResult result = orchestrator.execute(List.of(image("a.tif"), image("a.tif")), "", null).block();

        assertEquals(List.of("Images/a_mask.tif", "Images/a_1_mask.tif"), result.getArchive().getMembers());
    }

    private static String group(Pattern pattern, String script) {
        Matcher matcher = pattern.matcher(script);
        if (!matcher.find()) {
            throw new AssertionError("No match for " + pattern + " in script");
        }
        return matcher.group(1);
    }

    private static UploadedImage image(String name) {
        return new UploadedImage() {
            @Override
            public String filename() {
                return name;
            }

            @Override
            public Mono<Void> transferTo(Path destination) {
                return Mono.fromCallable(() -> Files.write(destination, ("pixels of " + name).getBytes(StandardCharsets.UTF_8)))
                        .then();
            }
        };
    }
}
