package com.example.sgkdocumentreader.service.packaging;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequence of (quality, width) pairs tried when the first encode is over
 * budget. Quality strictly decreases and width never increases from one step
 * to the next.
 */
public final class CompressionPlan {

    private CompressionPlan() {
    }

    public static List<Step> plan(int sourceWidth, float startQuality, int startWidth,
                                  float qualityFactor, double dimensionFactor, int attempts) {
        if (qualityFactor <= 0 || qualityFactor >= 1 || dimensionFactor <= 0 || dimensionFactor >= 1) {
            throw new IllegalArgumentException("Compression factors must be between 0 and 1");
        }
        int baseWidth = Math.max(1, Math.min(startWidth, sourceWidth));
        List<Step> steps = new ArrayList<>(attempts);
        float quality = startQuality;
        int previousWidth = Integer.MAX_VALUE;
        for (int i = 0; i < attempts; i++) {
            int width = (int) Math.round(baseWidth * Math.pow(dimensionFactor, i));
            if (previousWidth != Integer.MAX_VALUE && width >= previousWidth) {
                width = previousWidth - 1;
            }
            width = Math.max(1, width);
            steps.add(new Step(i + 1, quality, width));
            previousWidth = width;
            quality *= qualityFactor;
        }
        return List.copyOf(steps);
    }

    public record Step(int attempt, float quality, int width) {
    }
}
