package com.whereq.iris.service;

import com.whereq.iris.exception.ArchiveCreationException;
import com.whereq.iris.model.Archive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packages output files into a single zip archive.
 *
 * <p>Entry names are relative to the archive's own directory, so the categorized
 * subdirectories of a batch survive inside the archive. Missing and duplicate paths are
 * skipped. The archive only counts as created once it is found on disk afterwards.
 *
 * <p>Compression is blocking disk work; callers run it off the request threads.
 */
@Slf4j
@Service
public class ArchiveBuilder {

    /**
     * Build the archive.
     *
     * @param paths files to include
     * @param archivePath zip file to write
     * @return the written archive
     * @throws ArchiveCreationException if there is nothing to add, writing fails, or the
     *                                  archive is missing afterwards
     */
    public Archive build(Collection<Path> paths, Path archivePath) {
        if (paths == null || paths.isEmpty()) {
            log.warn("No files provided for ZIP creation");
            throw new ArchiveCreationException("No files provided for archive creation");
        }

        Path base = archivePath.toAbsolutePath().getParent();
        Set<String> seen = new HashSet<>();
        List<String> members = new ArrayList<>();

        try (OutputStream out = Files.newOutputStream(archivePath);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);

            for (Path path : paths) {
                if (!Files.isRegularFile(path)) {
                    log.warn("File not found, skipping: {}", path);
                    continue;
                }
                Path canonical = path.toRealPath();
                if (!seen.add(canonical.toString())) {
                    log.warn("Duplicate file skipped: {}", path);
                    continue;
                }

                String entryName = entryName(canonical, base);
                if (members.contains(entryName)) {
                    log.warn("Entry name {} already used, skipping: {}", entryName, path);
                    continue;
                }
                zip.putNextEntry(new ZipEntry(entryName));
                Files.copy(canonical, zip);
                zip.closeEntry();
                members.add(entryName);
                log.debug("Added to ZIP: {}", entryName);
            }
        } catch (IOException e) {
            log.error("Error creating ZIP file {}", archivePath, e);
            throw new ArchiveCreationException("Failed to create zip file: " + e.getMessage(), e);
        }

        if (members.isEmpty()) {
            deleteEmptyArchive(archivePath);
            throw new ArchiveCreationException("None of the output files exist anymore");
        }

        if (!Files.exists(archivePath)) {
            log.error("ZIP file not found after creation: {}", archivePath);
            throw new ArchiveCreationException("Failed to create zip file.");
        }

        try {
            long size = Files.size(archivePath);
            log.info("ZIP created successfully: {} ({} bytes, {} entries)", archivePath, size, members.size());
            return new Archive(archivePath, size, List.copyOf(members));
        } catch (IOException e) {
            throw new ArchiveCreationException("Failed to read created zip file: " + e.getMessage(), e);
        }
    }

    private String entryName(Path file, Path base) throws IOException {
        Path realBase = base != null && Files.isDirectory(base) ? base.toRealPath() : null;
        if (realBase != null && file.startsWith(realBase)) {
            return realBase.relativize(file).toString().replace('\\', '/');
        }
        return file.getFileName().toString();
    }

    private void deleteEmptyArchive(Path archivePath) {
        try {
            Files.deleteIfExists(archivePath);
        } catch (IOException e) {
            log.warn("Failed to delete empty archive {}", archivePath, e);
        }
    }
}
