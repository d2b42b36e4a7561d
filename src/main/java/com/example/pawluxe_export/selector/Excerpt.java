package com.example.pawluxe_export.selector;

import java.time.Duration;
import java.time.Instant;

/**
 * A slice of one recorded file.
 *
 * @param offsetSeconds   seek position inside {@code segmentPath}.
 * @param durationSeconds length of the slice.
 */
public record Excerpt(String cameraId,
                      String segmentId,
                      String segmentPath,
                      Instant clipStart,
                      Instant clipEnd,
                      double offsetSeconds,
                      double durationSeconds) {

    public Excerpt withEnd(Instant newEnd) {
        double duration = Math.max(seconds(Duration.between(clipStart, newEnd)), 0.0);
        return new Excerpt(cameraId, segmentId, segmentPath, clipStart, newEnd, offsetSeconds, duration);
    }

    static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
