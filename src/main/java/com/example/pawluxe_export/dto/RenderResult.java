package com.example.pawluxe_export.dto;

import java.nio.file.Path;

/**
 * @param outputPath   published video, or the manifest when no video was requested.
 * @param manifestPath published excerpt manifest.
 */
public record RenderResult(Path outputPath, Path manifestPath, int excerptCount, double renderedSeconds) {
}
