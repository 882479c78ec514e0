package com.fxpipeline.adapter.out.persistence;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A set of files written under temporary names and published together.
 * Files not committed are removed on close.
 */
@Slf4j
class StagedFiles implements AutoCloseable {

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final Path directory;
    private final Map<Path, Path> staged = new LinkedHashMap<>();
    private boolean committed;

    StagedFiles(Path directory) throws IOException {
        this.directory = Files.createDirectories(directory);
    }

    /**
     * Reserve a temporary path for a file that will be published as {@code fileName}.
     */
    Path stage(String fileName) throws IOException {
        Path target = directory.resolve(fileName);
        Path temp = directory.resolve("." + fileName + TEMP_SUFFIX);
        Files.deleteIfExists(temp);
        staged.put(temp, target);
        return temp;
    }

    /**
     * Move every staged file to its final name. Files it replaces are kept aside until all moves
     * succeed; if one fails, the published files are removed and the replaced ones restored.
     * @return final paths keyed by file name
     */
    Map<String, Path> commit() throws IOException {
        Map<String, Path> published = new LinkedHashMap<>();
        Map<Path, Path> backups = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Path target = entry.getValue();
                if (Files.exists(target)) {
                    Path backup = directory.resolve("." + target.getFileName() + BACKUP_SUFFIX);
                    move(target, backup);
                    backups.put(target, backup);
                }
                move(entry.getKey(), target);
                published.put(target.getFileName().toString(), target);
            }
        } catch (IOException e) {
            rollback(published.values(), backups, e);
            throw e;
        }
        committed = true;
        for (Path backup : backups.values()) {
            try {
                Files.deleteIfExists(backup);
            } catch (IOException e) {
                log.warn("Could not remove replaced file {}: {}", backup, e.getMessage());
            }
        }
        return published;
    }

    private void rollback(Iterable<Path> published, Map<Path, Path> backups, IOException cause) {
        for (Path target : published) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        for (Map.Entry<Path, Path> entry : backups.entrySet()) {
            try {
                move(entry.getValue(), entry.getKey());
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        log.error("Commit of {} files in {} failed and was rolled back: {}", staged.size(), directory, cause.getMessage());
    }

    @Override
    public void close() {
        if (committed) {
            return;
        }
        for (Path temp : staged.keySet()) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
