package com.example.cameratrap.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle locating a detected object. All values are normalised to the source
 * image, so {@code x = 0.5} is the horizontal centre regardless of the image resolution.
 */
@Schema(description = "Normalised rectangle describing a detected object")
public record BoundingBox(
        @Schema(description = "Left edge relative to image width", example = "0.21") double x,
        @Schema(description = "Top edge relative to image height", example = "0.40") double y,
        @Schema(description = "Width relative to image width", example = "0.18") double width,
        @Schema(description = "Height relative to image height", example = "0.25") double height) {

    public BoundingBox {
        requireNormalised("x", x);
        requireNormalised("y", y);
        requireNormalised("width", width);
        requireNormalised("height", height);
        if (width <= 0.0) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
        if (height <= 0.0) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
    }

    public double area() {
        return width * height;
    }

    private static void requireNormalised(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Bounding box " + name + " must be within [0, 1] but was " + value);
        }
    }
}
