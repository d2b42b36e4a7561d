package com.example.pawluxe_export.dto;

/**
 * Detection box in frame pixels.
 */
public record BoundingBox(double x, double y, double width, double height) {

    public boolean isValid() {
        return x >= 0 && y >= 0 && width > 0 && height > 0;
    }
}
