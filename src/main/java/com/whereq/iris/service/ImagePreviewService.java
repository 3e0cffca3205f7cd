package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.dto.PreviewResult;
import com.whereq.iris.engine.MacroEngine;
import com.whereq.iris.exception.EmptyBatchException;
import com.whereq.iris.exception.MacroExecutionException;
import com.whereq.iris.model.UploadedImage;
import com.whereq.iris.util.Filenames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Converts uploaded images into browser-displayable previews with the engine.
 *
 * <p>Each file gets its own temporary directory, released through the {@link CleanupScheduler}
 * once its preview has been read. The preview macro reports where it wrote the preview and the
 * metadata through a small log file; both are awaited because the engine may still be flushing
 * them when the macro returns.
 */
@Slf4j
@Service
public class ImagePreviewService {

    static final String OUTPUT_LOG = "output_log.txt";
    static final String METADATA_PREFIX = "METADATA_PATH:";
    static final String PREVIEW_PREFIX = "PREVIEW_PATH:";

    private final MacroEngine engine;
    private final MacroScriptRenderer renderer;
    private final FileReadinessWaiter readinessWaiter;
    private final CleanupScheduler cleanupScheduler;
    private final IrisProperties.PreviewConfig previewConfig;
    private final IrisProperties.WorkspaceConfig workspace;

    public ImagePreviewService(MacroEngine engine,
                               MacroScriptRenderer renderer,
                               FileReadinessWaiter readinessWaiter,
                               CleanupScheduler cleanupScheduler,
                               IrisProperties properties) {
        this.engine = engine;
        this.renderer = renderer;
        this.readinessWaiter = readinessWaiter;
        this.cleanupScheduler = cleanupScheduler;
        this.previewConfig = properties.getPreview();
        this.workspace = properties.getWorkspace();
    }

    /**
     * Preview every file in order. A failing file yields an error entry; the others still run.
     */
    public Flux<PreviewResult> preview(List<? extends UploadedImage> files) {
        if (files == null || files.isEmpty()) {
            return Flux.error(new EmptyBatchException());
        }
        return Flux.fromIterable(files).concatMap(this::preview);
    }

    Mono<PreviewResult> preview(UploadedImage file) {
        String original = file.filename() == null ? Filenames.sanitize(null) : file.filename();

        return Mono.fromCallable(this::createTempDirectory)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(tempDir -> convert(file, original, tempDir)
                .doFinally(signal -> cleanupScheduler.schedule(tempDir)))
            .onErrorResume(e -> {
                log.error("Error processing {}: {}", original, e.getMessage(), e);
                return Mono.just(PreviewResult.error(original, e.getMessage()));
            });
    }

    private Mono<PreviewResult> convert(UploadedImage file, String original, Path tempDir) {
        String uniqueFilename = UUID.randomUUID().toString().substring(0, 8) + "_" + Filenames.sanitize(original);
        Path inputPath = tempDir.resolve(uniqueFilename);
        Path outputLog = tempDir.resolve(OUTPUT_LOG);

        return file.transferTo(inputPath)
            .then(Mono.fromCallable(() -> {
                    log.info("Processing file: {}", inputPath);
                    String script = renderer.renderPreview(inputPath, tempDir, Filenames.stem(uniqueFilename), outputLog);
                    return engine.runMacro(script);
                })
                .subscribeOn(Schedulers.boundedElastic()))
            .then(readinessWaiter.awaitContent(outputLog, previewConfig.getLogTimeout(), previewConfig.getPollInterval()))
            .flatMap(content -> {
                ReportedPaths reported = ReportedPaths.parse(content);
                if (reported.preview == null) {
                    return Mono.error(new MacroExecutionException("Preview path missing from engine output"));
                }
                return readinessWaiter.requireStableFile(reported.preview, previewConfig.getFileTimeout(), previewConfig.getPollInterval())
                    .publishOn(Schedulers.boundedElastic())
                    .map(preview -> PreviewResult.builder()
                        .filename(original)
                        .uniqueFilename(uniqueFilename)
                        .preview(dataUri(preview))
                        .metadata(readMetadata(reported.metadata))
                        .fileType(Filenames.extension(original).toLowerCase(Locale.ROOT))
                        .build());
            })
            .doOnNext(result -> log.info("Preview ready for {}", original));
    }

    private Path createTempDirectory() throws IOException {
        Path root = workspace.getRoot() == null || workspace.getRoot().isBlank()
            ? Paths.get(System.getProperty("java.io.tmpdir"))
            : Files.createDirectories(Paths.get(workspace.getRoot()));
        return Files.createTempDirectory(root, "iris-preview-");
    }

    private String readMetadata(Path metadata) {
        if (metadata == null || !Files.isRegularFile(metadata)) {
            log.warn("Metadata file not found: {}", metadata);
            return "";
        }
        try {
            return Files.readString(metadata, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metadata " + metadata, e);
        }
    }

    private static String dataUri(Path preview) {
        try {
            return "data:image/png;base64," + Base64.getEncoder().encodeToString(Files.readAllBytes(preview));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read preview " + preview, e);
        }
    }

    /**
     * Paths announced by the preview macro.
     */
    static final class ReportedPaths {
        final Path metadata;
        final Path preview;

        private ReportedPaths(Path metadata, Path preview) {
            this.metadata = metadata;
            this.preview = preview;
        }

        static ReportedPaths parse(String content) {
            Path metadata = null;
            Path preview = null;
            for (String line : content.split("\\R")) {
                String trimmed = line.strip();
                if (trimmed.startsWith(METADATA_PREFIX)) {
                    metadata = Paths.get(trimmed.substring(METADATA_PREFIX.length()).strip());
                } else if (trimmed.startsWith(PREVIEW_PREFIX)) {
                    preview = Paths.get(trimmed.substring(PREVIEW_PREFIX.length()).strip());
                }
            }
            return new ReportedPaths(metadata, preview);
        }
    }
}
