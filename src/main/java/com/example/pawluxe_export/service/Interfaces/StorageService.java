package com.example.pawluxe_export.service.Interfaces;

import java.nio.file.Path;
import java.util.UUID;

public interface StorageService {
    /**
     * Final location of the video rendered by one attempt of a job. Attempts never share a path, so a
     * late attempt cannot overwrite or delete the output another attempt completed with.
     */
    Path videoPath(UUID jobId, String attemptTag);

    /** Final location of the excerpt manifest written by one attempt of a job. */
    Path manifestPath(UUID jobId, String attemptTag);

    /** Moves a finished file into the export tree. */
    void publish(Path source, Path target);

    /** @return {@code true} when a file was removed. */
    boolean delete(Path target);
}
