package com.example.pawluxe_export.selector;

import com.example.pawluxe_export.config.ExportQueueProperties;

import java.time.Duration;

/**
 * @param mergeGap         largest gap between two excerpts of the same file that still merges them.
 * @param minExcerpt       excerpts shorter than this are dropped.
 * @param highlightTarget  total length of a highlight reel.
 * @param highlightPerClip longest single excerpt in a highlight reel.
 */
public record PlannerConfig(Duration mergeGap,
                            Duration minExcerpt,
                            Duration highlightTarget,
                            Duration highlightPerClip) {

    public static PlannerConfig from(ExportQueueProperties.Render render) {
        return new PlannerConfig(render.getMergeGap(), render.getMinExcerpt(),
                render.getHighlightTarget(), render.getHighlightPerClip());
    }
}
