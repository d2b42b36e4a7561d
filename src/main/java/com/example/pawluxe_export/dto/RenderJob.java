package com.example.pawluxe_export.dto;

import java.time.Duration;
import java.util.UUID;

/**
 * One render attempt handed from the dispatcher to the render engine.
 *
 * @param attemptTag identifies this claim of the job; published artifacts are named after it.
 */
public record RenderJob(UUID jobId, String attemptTag, RenderParams params, Duration timeout) {
}
