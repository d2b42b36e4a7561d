package com.example.pawluxe_export.selector;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy highlight reel: repeatedly takes the best scoring excerpt, trimmed to the per-clip cap, until the
 * target length is reached. Repeats from the same camera or the same minute are penalised so the reel
 * spreads across the window.
 */
public class HighlightSelector {
    private static final double CAMERA_PENALTY = 0.25;
    private static final double MINUTE_PENALTY = 0.15;

    public List<Excerpt> select(List<Excerpt> excerpts, Duration target, Duration perClip) {
        double remaining = Math.max(Excerpt.seconds(target), 0.0);
        double clipCap = Math.max(Excerpt.seconds(perClip), 0.1);
        if (remaining <= 0.0 || excerpts.isEmpty()) {
            return List.of();
        }

        List<Excerpt> candidates = new ArrayList<>(excerpts);
        Map<String, Integer> cameraCount = new HashMap<>();
        Map<Instant, Integer> minuteCount = new HashMap<>();
        List<Excerpt> selected = new ArrayList<>();

        while (!candidates.isEmpty() && remaining > 0.0) {
            int bestIdx = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < candidates.size(); i++) {
                Excerpt item = candidates.get(i);
                double durationScore = Math.min(item.durationSeconds(), clipCap) / clipCap;
                double score = durationScore
                        - cameraCount.getOrDefault(item.cameraId(), 0) * CAMERA_PENALTY
                        - minuteCount.getOrDefault(minuteOf(item), 0) * MINUTE_PENALTY;
                if (score > bestScore) {
                    bestScore = score;
                    bestIdx = i;
                }
            }
            Excerpt item = candidates.remove(bestIdx);
            double take = Math.min(Math.min(item.durationSeconds(), clipCap), remaining);
            if (take <= 0.0) {
                continue;
            }
            long takeNanos = Math.round(take * 1_000_000_000.0);
            selected.add(item.withEnd(item.clipStart().plusNanos(takeNanos)));
            cameraCount.merge(item.cameraId(), 1, Integer::sum);
            minuteCount.merge(minuteOf(item), 1, Integer::sum);
            remaining -= take;
        }
        selected.sort(Comparator.comparing(Excerpt::clipStart));
        return selected;
    }

    private static Instant minuteOf(Excerpt excerpt) {
        return excerpt.clipStart().truncatedTo(ChronoUnit.MINUTES);
    }
}
