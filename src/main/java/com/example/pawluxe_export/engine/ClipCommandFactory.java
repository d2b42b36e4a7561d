package com.example.pawluxe_export.engine;

import com.example.pawluxe_export.selector.Excerpt;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the external command lines of a render. The encoder itself is not part of the queue.
 */
public interface ClipCommandFactory {
    List<String> trim(Excerpt excerpt, Path output);

    /**
     * @param listFile concat list with one {@code file '<path>'} line per part.
     */
    List<String> concat(Path listFile, Path output);
}
