package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.engine.MacroEngine;
import com.whereq.iris.exception.ArchiveCreationException;
import com.whereq.iris.exception.BatchExecutionException;
import com.whereq.iris.exception.EmptyBatchException;
import com.whereq.iris.exception.EngineUnavailableException;
import com.whereq.iris.exception.NoOutputsProducedException;
import com.whereq.iris.model.Archive;
import com.whereq.iris.model.BatchResult;
import com.whereq.iris.model.ExecutionRecord;
import com.whereq.iris.model.Job;
import com.whereq.iris.model.JobParameters;
import com.whereq.iris.model.UploadedImage;
import com.whereq.iris.util.Filenames;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a user macro against every image of a batch and packages what it produced.
 *
 * <p>All jobs of a batch share one working directory. Jobs run strictly one after the other
 * because the engine is a process-wide, non-reentrant resource. A failing job is recorded in
 * the error log and the batch moves on; the batch itself only fails when no job produced any
 * output or the archive cannot be written. The working directory is always handed to the
 * {@link CleanupScheduler}, whichever way the batch ends.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class MacroOrchestrator {

    private final MacroEngine engine;
    private final MacroScriptRenderer renderer;
    private final OutputCollector outputCollector;
    private final ArchiveBuilder archiveBuilder;
    private final CleanupScheduler cleanupScheduler;
    private final IrisProperties.WorkspaceConfig workspace;

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter jobFailureCounter;
    private final Timer executionTimer;

    public MacroOrchestrator(MacroEngine engine,
                             MacroScriptRenderer renderer,
                             OutputCollector outputCollector,
                             ArchiveBuilder archiveBuilder,
                             CleanupScheduler cleanupScheduler,
                             IrisProperties properties,
                             MeterRegistry meterRegistry) {
        this.engine = engine;
        this.renderer = renderer;
        this.outputCollector = outputCollector;
        this.archiveBuilder = archiveBuilder;
        this.cleanupScheduler = cleanupScheduler;
        this.workspace = properties.getWorkspace();

        this.successCounter = Counter.builder("iris.batches.succeeded")
            .description("Number of batches that produced an archive")
            .register(meterRegistry);
        this.failureCounter = Counter.builder("iris.batches.failed")
            .description("Number of batches without any output")
            .register(meterRegistry);
        this.jobFailureCounter = Counter.builder("iris.jobs.failed")
            .description("Number of images whose macro run failed")
            .register(meterRegistry);
        this.executionTimer = Timer.builder("iris.batches.execution.time")
            .description("Batch execution time")
            .register(meterRegistry);
    }

    /**
     * Execute {@code script} against every file.
     *
     * <p>The batch runs on the bounded elastic scheduler and is detached from the subscriber:
     * cancelling the returned Mono stops waiting for the result but does not stop work already
     * handed to the engine.
     *
     * @param files uploaded images, at least one
     * @param script user macro, blank for the template's default processing
     * @param parameters particle bounds, null for defaults
     * @return the archive plus the per-file error log; errors with {@link EmptyBatchException}
     * when there are no files, {@link EngineUnavailableException} when the engine never came
     * up, {@link NoOutputsProducedException} when no job produced output,
     * {@link ArchiveCreationException} when packaging failed
     */
    public Mono<BatchResult> execute(List<? extends UploadedImage> files, String script, JobParameters parameters) {
        if (files == null || files.isEmpty()) {
            return Mono.error(new EmptyBatchException());
        }
        if (!engine.isReady()) {
            return Mono.error(new EngineUnavailableException("ImageJ engine is not initialized"));
        }
        JobParameters effective = parameters != null ? parameters : JobParameters.defaults();

        return Mono.defer(() -> {
            Sinks.One<BatchResult> result = Sinks.one();
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    result.tryEmitValue(executeBlocking(files, script, effective));
                } catch (Exception e) {
                    result.tryEmitError(e);
                }
            });
            return result.asMono();
        });
    }

    /**
     * Run the batch on the calling thread.
     */
    BatchResult executeBlocking(List<? extends UploadedImage> files, String script, JobParameters parameters) {
        log.info("Starting macro execution on {} files.", files.size());
        long startTime = System.currentTimeMillis();

        Path workingDir = createWorkingDirectory();
        try {
            List<ExecutionRecord> records = new ArrayList<>();
            List<String> errorLog = new ArrayList<>();
            List<Path> inputs = new ArrayList<>();
            Set<Path> outputs = new LinkedHashSet<>();

            for (UploadedImage file : files) {
                ExecutionRecord record = runJob(file, workingDir, script, parameters, inputs);
                records.add(record);
                if (record.isFailed()) {
                    errorLog.add(record.getError());
                    jobFailureCounter.increment();
                } else if (!record.hasOutputs()) {
                    log.warn("Macro produced no output files for {}", record.getJob().getFilename());
                }
                outputs.addAll(record.getOutputs());
            }
            inputs.forEach(outputs::remove);

            if (outputs.isEmpty()) {
                log.error("No output files were generated ({} of {} files failed)", errorLog.size(), files.size());
                failureCounter.increment();
                throw new NoOutputsProducedException(errorLog);
            }

            log.info("Creating ZIP file with {} files.", outputs.size());
            Archive archive;
            try {
                archive = archiveBuilder.build(outputs, workingDir.resolve(workspace.getArchiveName()));
            } catch (ArchiveCreationException e) {
                failureCounter.increment();
                throw new ArchiveCreationException(e.getMessage(), errorLog, e);
            }

            successCounter.increment();
            log.info("Batch finished: {} archived file(s), {} error(s)", archive.getMembers().size(), errorLog.size());
            return BatchResult.builder()
                .archive(archive)
                .errorLog(errorLog)
                .records(records)
                .build();
        } finally {
            cleanupScheduler.schedule(workingDir);
            executionTimer.record(Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
    }

    /**
     * Persist, render, invoke and collect one image. Never throws: any failure is captured
     * in the returned record.
     */
    private ExecutionRecord runJob(UploadedImage file, Path workingDir, String script,
                                   JobParameters parameters, List<Path> inputs) {
        String filename = Filenames.unique(workingDir, Filenames.sanitize(file.filename()));
        Path inputPath = workingDir.resolve(filename);
        Job job = Job.builder()
            .originalFilename(file.filename())
            .filename(filename)
            .nameStem(Filenames.stem(filename))
            .inputPath(inputPath)
            .workingDir(workingDir)
            .parameters(parameters)
            .build();

        try {
            file.transferTo(inputPath).block();
            inputs.add(inputPath.toRealPath());
            log.info("Processing image: {}", inputPath);

            String output = engine.runMacro(renderer.render(job, script)).text();
            log.debug("Macro output:\n{}", output);

            Set<Path> produced = outputCollector.collect(output, workingDir, job.getNameStem(), inputs);
            log.info("Saved files for {}: {}", filename, produced);
            return ExecutionRecord.builder()
                .job(job)
                .log(output)
                .outputs(produced)
                .build();
        } catch (Exception e) {
            String message = "Error processing " + filename + ": " + e.getMessage();
            log.error(message, e);
            return ExecutionRecord.builder()
                .job(job)
                .log("")
                .error(message)
                .build();
        }
    }

    private Path createWorkingDirectory() {
        try {
            Path root = workspace.getRoot() == null || workspace.getRoot().isBlank()
                ? Paths.get(System.getProperty("java.io.tmpdir"))
                : Files.createDirectories(Paths.get(workspace.getRoot()));
            Path workingDir = Files.createTempDirectory(root, "iris-batch-");
            for (String subdir : workspace.getOutputSubdirectories()) {
                Files.createDirectories(workingDir.resolve(subdir));
            }
            log.debug("Created working directory {}", workingDir);
            return workingDir;
        } catch (IOException e) {
            throw new BatchExecutionException("Failed to create working directory: " + e.getMessage(), List.of(), e);
        }
    }
}
