package com.example.sgkdocumentreader.model;

import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.Optional;

/**
 * Page raster after boundary detection and cropping.
 *
 * @param image            cropped raster, never larger than the source
 * @param boundaryDetected {@code true} when a scored boundary was used,
 *                         {@code false} for the margin-trim fallback
 * @param boundary         detected outline in source coordinates, null for the fallback
 * @param strategy         name of the strategy that produced the boundary, or {@code margin-trim}
 */
public record RectifiedImage(BufferedImage image, boolean boundaryDetected, Quadrilateral boundary, String strategy) {

    public RectifiedImage {
        Objects.requireNonNull(image, "image");
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public Optional<Quadrilateral> detectedBoundary() {
        return Optional.ofNullable(boundary);
    }
}
