package com.example.pawluxe_export.selector;

import com.example.pawluxe_export.dto.RenderParams;
import com.example.pawluxe_export.dto.SourceSegment;
import com.example.pawluxe_export.util.ClipKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a render window plus the recordings covering it into the ordered list of excerpts to encode.
 */
public class ExcerptPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExcerptPlanner.class);

    private final PlannerConfig config;
    private final HighlightSelector highlightSelector;

    public ExcerptPlanner(PlannerConfig config) {
        this(config, new HighlightSelector());
    }

    public ExcerptPlanner(PlannerConfig config, HighlightSelector highlightSelector) {
        this.config = config;
        this.highlightSelector = highlightSelector;
    }

    public List<Excerpt> plan(RenderParams params) {
        List<Excerpt> raw = new ArrayList<>();
        for (SourceSegment segment : params.segments()) {
            Instant start = max(params.windowStart(), segment.start());
            Instant end = min(params.windowEnd(), segment.end());
            if (!end.isAfter(start)) {
                LOGGER.trace("planner skip segment={} outside window", segment.segmentId());
                continue;
            }
            double offset = Math.max(Excerpt.seconds(Duration.between(segment.start(), start)), 0.0);
            raw.add(new Excerpt(params.cameraId(), segment.segmentId(), segment.path(), start, end,
                    offset, Excerpt.seconds(Duration.between(start, end))));
        }

        List<Excerpt> merged = mergeAndFilter(raw);
        if (params.kind() == ClipKind.HIGHLIGHTS) {
            return highlightSelector.select(merged, config.highlightTarget(), config.highlightPerClip());
        }
        return merged;
    }

    List<Excerpt> mergeAndFilter(List<Excerpt> excerpts) {
        if (excerpts.isEmpty()) {
            return List.of();
        }
        double gap = Math.max(Excerpt.seconds(config.mergeGap()), 0.0);
        double minDuration = Math.max(Excerpt.seconds(config.minExcerpt()), 0.0);

        List<Excerpt> ordered = new ArrayList<>(excerpts);
        ordered.sort(Comparator.comparing(Excerpt::clipStart));

        List<Excerpt> result = new ArrayList<>();
        Excerpt current = ordered.get(0);
        for (Excerpt next : ordered.subList(1, ordered.size())) {
            boolean sameFile = current.segmentPath().equals(next.segmentPath());
            boolean contiguous = Excerpt.seconds(Duration.between(current.clipEnd(), next.clipStart())) <= gap;
            if (sameFile && contiguous) {
                current = current.withEnd(max(current.clipEnd(), next.clipEnd()));
                continue;
            }
            if (current.durationSeconds() >= minDuration) {
                result.add(current);
            }
            current = next;
        }
        if (current.durationSeconds() >= minDuration) {
            result.add(current);
        }
        return result;
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
