package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.util.ImagePreprocessor;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Downscaled copy of a page image with the derived grayscale and gradient
 * buffers that boundary strategies work on. Buffers are row-major and must
 * not be modified.
 */
public record AnalysisFrame(BufferedImage image, int width, int height, int[] gray, int[] gradient) {

    public AnalysisFrame {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(gray, "gray");
        Objects.requireNonNull(gradient, "gradient");
    }

    public static AnalysisFrame of(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] gray = ImagePreprocessor.toGrayscale(image);
        int[] blurred = ImagePreprocessor.blur(gray, width, height);
        int[] gradient = ImagePreprocessor.sobelMagnitude(blurred, width, height);
        return new AnalysisFrame(image, width, height, gray, gradient);
    }

    public int grayAt(int x, int y) {
        return gray[y * width + x];
    }

    public int gradientAt(int x, int y) {
        return gradient[y * width + x];
    }

    public long area() {
        return (long) width * height;
    }
}
