package com.example.sgkdocumentreader.util;

import com.example.sgkdocumentreader.model.BoundingBox;

import java.awt.*;
import java.awt.image.BufferedImage;

/**
 * Raster helpers shared by boundary detection and packaging. Everything here
 * runs on plain {@link BufferedImage}s so the pipeline works without native
 * libraries.
 */
public final class ImagePreprocessor {

    private static final int[] BLUR_KERNEL = {1, 4, 6, 4, 1};
    private static final int BLUR_WEIGHT = 16;

    private ImagePreprocessor() {
    }

    /**
     * Downscales so that the longest side is at most {@code maxDimension}.
     * Returns the input unchanged when it already fits.
     */
    public static BufferedImage scaleToMaxDimension(BufferedImage input, int maxDimension) {
        requireImage(input);
        int longest = Math.max(input.getWidth(), input.getHeight());
        if (longest <= maxDimension) {
            return input;
        }
        double ratio = maxDimension / (double) longest;
        int width = Math.max(1, (int) Math.round(input.getWidth() * ratio));
        int height = Math.max(1, (int) Math.round(input.getHeight() * ratio));
        return resize(input, width, height);
    }

    public static BufferedImage scaleToWidth(BufferedImage input, int width) {
        requireImage(input);
        if (width >= input.getWidth()) {
            return toRgb(input);
        }
        int targetWidth = Math.max(1, width);
        int height = Math.max(1, (int) Math.round(input.getHeight() * (targetWidth / (double) input.getWidth())));
        return resize(input, targetWidth, height);
    }

    /** Opaque RGB copy suitable for JPEG encoding. */
    public static BufferedImage toRgb(BufferedImage input) {
        requireImage(input);
        if (input.getType() == BufferedImage.TYPE_INT_RGB) {
            return input;
        }
        return resize(input, input.getWidth(), input.getHeight());
    }

    /** Luma with ITU-R BT.601 weights, one int per pixel in row-major order. */
    public static int[] toGrayscale(BufferedImage input) {
        requireImage(input);
        int width = input.getWidth();
        int height = input.getHeight();
        int[] rgb = input.getRGB(0, 0, width, height, null, 0, width);
        int[] gray = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            int pixel = rgb[i];
            int r = (pixel >> 16) & 0xFF;
            int g = (pixel >> 8) & 0xFF;
            int b = pixel & 0xFF;
            gray[i] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        }
        return gray;
    }

    /** Separable 5-tap binomial blur, borders clamped. */
    public static int[] blur(int[] gray, int width, int height) {
        int[] horizontal = new int[gray.length];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                int sum = 0;
                for (int k = -2; k <= 2; k++) {
                    int sx = Math.max(0, Math.min(width - 1, x + k));
                    sum += gray[row + sx] * BLUR_KERNEL[k + 2];
                }
                horizontal[row + x] = sum / BLUR_WEIGHT;
            }
        }
        int[] blurred = new int[gray.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int sum = 0;
                for (int k = -2; k <= 2; k++) {
                    int sy = Math.max(0, Math.min(height - 1, y + k));
                    sum += horizontal[sy * width + x] * BLUR_KERNEL[k + 2];
                }
                blurred[y * width + x] = sum / BLUR_WEIGHT;
            }
        }
        return blurred;
    }

    /** Sobel gradient magnitude. Border pixels are left at zero. */
    public static int[] sobelMagnitude(int[] gray, int width, int height) {
        int[] magnitude = new int[gray.length];
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int topLeft = gray[(y - 1) * width + x - 1];
                int top = gray[(y - 1) * width + x];
                int topRight = gray[(y - 1) * width + x + 1];
                int left = gray[y * width + x - 1];
                int right = gray[y * width + x + 1];
                int bottomLeft = gray[(y + 1) * width + x - 1];
                int bottom = gray[(y + 1) * width + x];
                int bottomRight = gray[(y + 1) * width + x + 1];
                int gx = -topLeft - 2 * left - bottomLeft + topRight + 2 * right + bottomRight;
                int gy = -topLeft - 2 * top - topRight + bottomLeft + 2 * bottom + bottomRight;
                magnitude[y * width + x] = (int) Math.round(Math.sqrt((double) gx * gx + (double) gy * gy));
            }
        }
        return magnitude;
    }

    /** Copies the region so the result does not share the source raster. */
    public static BufferedImage crop(BufferedImage source, BoundingBox box) {
        requireImage(source);
        BoundingBox clamped = box.clampTo(source.getWidth(), source.getHeight());
        BufferedImage cropped = new BufferedImage(clamped.width(), clamped.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = cropped.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, clamped.width(), clamped.height());
            g.drawImage(source,
                    0, 0, clamped.width(), clamped.height(),
                    clamped.x(), clamped.y(), clamped.right(), clamped.bottom(),
                    null);
        } finally {
            g.dispose();
        }
        return cropped;
    }

    private static BufferedImage resize(BufferedImage input, int width, int height) {
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(input, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    private static void requireImage(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
    }
}
