package com.example.pawluxe_export.service;

import com.example.pawluxe_export.exception.StorageException;
import com.example.pawluxe_export.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.regex.Pattern;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Export tree on local disk: {@code <base>/videos/<jobId>-<attempt>.mp4} and
 * {@code <base>/manifests/<jobId>-<attempt>.json}.
 */
public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);
    private static final Pattern ATTEMPT_TAG = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path baseDir;
    private final Path videosDir;
    private final Path manifestsDir;

    public LocalStorageService(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.videosDir = this.baseDir.resolve("videos");
        this.manifestsDir = this.baseDir.resolve("manifests");

        try {
            Files.createDirectories(videosDir);
            Files.createDirectories(manifestsDir);
            LOGGER.info("LocalStorageService ready. base={}, videos={}, manifests={}", this.baseDir, videosDir, manifestsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create export directories under " + this.baseDir, e);
        }
    }

    @Override
    public Path videoPath(UUID jobId, String attemptTag) {
        return videosDir.resolve(fileStem(jobId, attemptTag) + ".mp4");
    }

    @Override
    public Path manifestPath(UUID jobId, String attemptTag) {
        return manifestsDir.resolve(fileStem(jobId, attemptTag) + ".json");
    }

    @Override
    public void publish(Path source, Path target) {
        Path dest = insideBase(target);
        try {
            Files.createDirectories(dest.getParent());
            try {
                Files.move(source, dest, REPLACE_EXISTING, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                // scratch space on another file system
                Files.copy(source, dest, REPLACE_EXISTING);
                Files.delete(source);
            }
        } catch (IOException e) {
            throw new StorageException("Publish failed: " + source + " -> " + dest, e);
        }
    }

    @Override
    public boolean delete(Path target) {
        Path dest = insideBase(target);
        try {
            return Files.deleteIfExists(dest);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + dest, e);
        }
    }

    private static String fileStem(UUID jobId, String attemptTag) {
        if (attemptTag == null || !ATTEMPT_TAG.matcher(attemptTag).matches()) {
            throw new StorageException("Invalid attempt tag for job " + jobId + ": " + attemptTag);
        }
        return jobId + "-" + attemptTag;
    }

    private Path insideBase(Path target) {
        Path p = target.toAbsolutePath().normalize();
        if (!p.startsWith(baseDir)) {
            throw new StorageException("Path escapes export dir: " + target);
        }
        return p;
    }
}
