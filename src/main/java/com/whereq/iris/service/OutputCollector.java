package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.model.OutputFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Works out which files a macro run produced.
 *
 * <p>Two sources are combined: lines of the macro log that start with the output marker
 * (authoritative but possibly incomplete), and a recursive scan of the working directory for
 * files named after the image. Every candidate is checked once, at collection time, for
 * existence and a non-zero size; rejected candidates are logged and dropped.
 */
@Slf4j
@Service
public class OutputCollector {

    private final String outputMarker;

    public OutputCollector(IrisProperties properties) {
        this.outputMarker = properties.getEngine().getOutputMarker();
    }

    /**
     * Collect the outputs of one macro run.
     *
     * @param logText text the macro printed
     * @param workingDir batch working directory
     * @param nameStem image filename without extension
     * @return canonical paths of valid outputs, declared ones first
     */
    public Set<Path> collect(String logText, Path workingDir, String nameStem) {
        return collect(logText, workingDir, nameStem, List.of());
    }

    /**
     * As {@link #collect(String, Path, String)}, never returning any of {@code excluded}
     * (the batch's own input images, which match their stem too).
     */
    public Set<Path> collect(String logText, Path workingDir, String nameStem, Collection<Path> excluded) {
        return collectFiles(logText, workingDir, nameStem, excluded).stream()
                .map(OutputFile::getPath)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<OutputFile> collectFiles(String logText, Path workingDir, String nameStem, Collection<Path> excluded) {
        Set<Path> skip = excluded.stream()
                .map(this::canonicalize)
                .flatMap(Optional::stream)
                .collect(Collectors.toSet());

        Set<OutputFile> files = new LinkedHashSet<>();
        for (Path declared : declaredPaths(logText, workingDir)) {
            validate(declared, OutputFile.Provenance.DECLARED)
                    .filter(file -> !skip.contains(file.getPath()))
                    .ifPresent(files::add);
        }
        for (Path discovered : scan(workingDir, nameStem)) {
            validate(discovered, OutputFile.Provenance.DISCOVERED)
                    .filter(file -> !skip.contains(file.getPath()))
                    .ifPresent(files::add);
        }

        if (files.isEmpty()) {
            log.warn("No valid files found for {}", nameStem);
        } else {
            log.info("Found {} output file(s) for {}", files.size(), nameStem);
        }
        return files;
    }

    /**
     * Paths announced by marker lines. Doubled separators and backslashes are normalized;
     * relative paths resolve against the working directory.
     */
    List<Path> declaredPaths(String logText, Path workingDir) {
        if (logText == null || logText.isEmpty()) {
            return List.of();
        }
        return logText.lines()
                .map(String::strip)
                .filter(line -> line.startsWith(outputMarker))
                .map(line -> line.substring(outputMarker.length()).strip())
                .filter(value -> !value.isEmpty())
                .map(value -> value.replace('\\', '/').replaceAll("/{2,}", "/"))
                .map(value -> toPath(value, workingDir))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    private List<Path> scan(Path workingDir, String nameStem) {
        if (nameStem == null || nameStem.isEmpty() || !Files.isDirectory(workingDir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(workingDir)) {
            return walk
                    .filter(path -> path.getFileName().toString().startsWith(nameStem))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to scan {} for outputs of {}: {}", workingDir, nameStem, e.getMessage());
            return List.of();
        }
    }

    private Optional<OutputFile> validate(Path candidate, OutputFile.Provenance provenance) {
        try {
            if (!Files.isRegularFile(candidate)) {
                log.warn("Invalid or missing file: {}", candidate);
                return Optional.empty();
            }
            long size = Files.size(candidate);
            if (size == 0) {
                log.warn("Empty file skipped: {}", candidate);
                return Optional.empty();
            }
            return Optional.of(new OutputFile(candidate.toRealPath(), size, provenance));
        } catch (IOException e) {
            log.warn("Could not inspect {}: {}", candidate, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> toPath(String value, Path workingDir) {
        try {
            Path path = Paths.get(value);
            return Optional.of(path.isAbsolute() ? path.normalize() : workingDir.resolve(path).normalize());
        } catch (InvalidPathException e) {
            log.warn("Ignoring unparseable output path '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> canonicalize(Path path) {
        try {
            return Optional.of(path.toRealPath());
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
