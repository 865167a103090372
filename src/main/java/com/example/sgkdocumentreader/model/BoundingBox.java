package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle on the pixel grid of a page image, origin in the
 * top-left corner. Used as the crop window of a detected document boundary.
 */
@Schema(description = "Axis-aligned rectangle describing the cropped page region")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "96") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "140") int y,
        @Schema(description = "Width in pixels", example = "1810") int width,
        @Schema(description = "Height in pixels", example = "2560") int height) {

    public BoundingBox {
        if (width <= 0) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
    }

    public long area() {
        return (long) width * height;
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    /**
     * Restricts the box to an image of the given size. Always returns a box of
     * at least one pixel.
     */
    public BoundingBox clampTo(int imageWidth, int imageHeight) {
        int clampedX = clamp(x, 0, imageWidth - 1);
        int clampedY = clamp(y, 0, imageHeight - 1);
        int clampedWidth = clamp(width, 1, imageWidth - clampedX);
        int clampedHeight = clamp(height, 1, imageHeight - clampedY);
        return new BoundingBox(clampedX, clampedY, clampedWidth, clampedHeight);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
