package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.Quadrilateral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Separates a bright sheet from a darker background using the two dominant
 * peaks of the brightness histogram, then trims rows and columns that hold
 * too little bright content.
 */
public class BrightnessProfileBoundaryStrategy implements BoundaryStrategy {

    private static final Logger log = LoggerFactory.getLogger(BrightnessProfileBoundaryStrategy.class);

    private static final int DEFAULT_THRESHOLD = 128;
    private static final int PEAK_OFFSET = 30;
    private static final int MIN_PEAK_DISTANCE = 30;
    private static final double CONTENT_RATIO = 0.15;
    private static final double SCAN_LIMIT = 0.4;
    private static final int PADDING = 10;
    private static final double MIN_AREA_RATIO = 0.10;
    private static final double MAX_AREA_RATIO = 0.95;
    private static final double MIN_SIDE_RATIO = 0.3;

    @Override
    public String name() {
        return "brightness-profile";
    }

    @Override
    public Optional<Quadrilateral> detect(AnalysisFrame frame) {
        int width = frame.width();
        int height = frame.height();
        int threshold = threshold(frame);

        int scanRows = (int) (height * SCAN_LIMIT);
        int scanColumns = (int) (width * SCAN_LIMIT);

        int top = 0;
        for (int y = 0; y < scanRows; y++) {
            if (rowRatio(frame, y, threshold) > CONTENT_RATIO) {
                top = y;
                break;
            }
        }
        int bottom = height - 1;
        for (int y = height - 1; y >= height - scanRows; y--) {
            if (rowRatio(frame, y, threshold) > CONTENT_RATIO) {
                bottom = y;
                break;
            }
        }
        int left = 0;
        for (int x = 0; x < scanColumns; x++) {
            if (columnRatio(frame, x, threshold) > CONTENT_RATIO) {
                left = x;
                break;
            }
        }
        int right = width - 1;
        for (int x = width - 1; x >= width - scanColumns; x--) {
            if (columnRatio(frame, x, threshold) > CONTENT_RATIO) {
                right = x;
                break;
            }
        }

        top = Math.max(0, top - PADDING);
        left = Math.max(0, left - PADDING);
        bottom = Math.min(height - 1, bottom + PADDING);
        right = Math.min(width - 1, right + PADDING);

        int boxWidth = right - left;
        int boxHeight = bottom - top;
        double areaRatio = (double) boxWidth * boxHeight / frame.area();
        if (areaRatio < MIN_AREA_RATIO || areaRatio > MAX_AREA_RATIO
                || boxWidth < width * MIN_SIDE_RATIO || boxHeight < height * MIN_SIDE_RATIO) {
            log.debug("Brightness rectangle rejected: area ratio {} at threshold {}", areaRatio, threshold);
            return Optional.empty();
        }
        return Optional.of(Quadrilateral.ofRectangle(left, top, right, bottom));
    }

    static int threshold(AnalysisFrame frame) {
        int[] histogram = new int[256];
        for (int value : frame.gray()) {
            histogram[Math.max(0, Math.min(255, value))]++;
        }
        int firstPeak = -1;
        for (int level = 0; level < histogram.length; level++) {
            if (firstPeak < 0 || histogram[level] > histogram[firstPeak]) {
                firstPeak = level;
            }
        }
        int secondPeak = -1;
        for (int level = 0; level < histogram.length; level++) {
            if (Math.abs(level - firstPeak) < MIN_PEAK_DISTANCE || histogram[level] == 0) {
                continue;
            }
            if (secondPeak < 0 || histogram[level] > histogram[secondPeak]) {
                secondPeak = level;
            }
        }
        long minimumPeakHeight = frame.area() / 100;
        if (secondPeak < 0 || histogram[secondPeak] < minimumPeakHeight) {
            return DEFAULT_THRESHOLD;
        }
        return Math.min(firstPeak, secondPeak) + PEAK_OFFSET;
    }

    private static double rowRatio(AnalysisFrame frame, int y, int threshold) {
        int bright = 0;
        for (int x = 0; x < frame.width(); x++) {
            if (frame.grayAt(x, y) > threshold) {
                bright++;
            }
        }
        return bright / (double) frame.width();
    }

    private static double columnRatio(AnalysisFrame frame, int x, int threshold) {
        int bright = 0;
        for (int y = 0; y < frame.height(); y++) {
            if (frame.grayAt(x, y) > threshold) {
                bright++;
            }
        }
        return bright / (double) frame.height();
    }
}
