package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.Quadrilateral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Scans inward from each border of the gradient map and stops at the first
 * row or column whose edge density exceeds a fixed share of the perpendicular
 * extent.
 */
public class EdgeDensityBoundaryStrategy implements BoundaryStrategy {

    private static final Logger log = LoggerFactory.getLogger(EdgeDensityBoundaryStrategy.class);

    static final int EDGE_MAGNITUDE = 50;
    private static final double MIN_AREA_RATIO = 0.15;
    private static final double MAX_AREA_RATIO = 0.95;
    private static final double MIN_SIDE_RATIO = 0.3;

    private final double densityFraction;
    private final double marginFraction;

    public EdgeDensityBoundaryStrategy(double densityFraction, double marginFraction) {
        this.densityFraction = densityFraction;
        this.marginFraction = marginFraction;
    }

    @Override
    public String name() {
        return "edge-density";
    }

    @Override
    public Optional<Quadrilateral> detect(AnalysisFrame frame) {
        int width = frame.width();
        int height = frame.height();
        int margin = (int) (Math.min(width, height) * marginFraction);
        if (width - 2 * margin < 3 || height - 2 * margin < 3) {
            return Optional.empty();
        }

        double rowThreshold = (width - 2 * margin) * densityFraction;
        int top = -1;
        for (int y = margin; y < height / 2; y++) {
            if (rowEdges(frame, y, margin, width - margin) > rowThreshold) {
                top = y;
                break;
            }
        }
        int bottom = -1;
        for (int y = height - 1 - margin; y > height / 2; y--) {
            if (rowEdges(frame, y, margin, width - margin) > rowThreshold) {
                bottom = y;
                break;
            }
        }
        if (top < 0 || bottom < 0) {
            log.debug("No horizontal page edges found");
            return Optional.empty();
        }

        double columnThreshold = (bottom - top) * densityFraction;
        int left = -1;
        for (int x = margin; x < width / 2; x++) {
            if (columnEdges(frame, x, top, bottom) > columnThreshold) {
                left = x;
                break;
            }
        }
        int right = -1;
        for (int x = width - 1 - margin; x > width / 2; x--) {
            if (columnEdges(frame, x, top, bottom) > columnThreshold) {
                right = x;
                break;
            }
        }
        if (left < 0 || right < 0) {
            log.debug("No vertical page edges found");
            return Optional.empty();
        }

        int boxWidth = right - left;
        int boxHeight = bottom - top;
        double areaRatio = (double) boxWidth * boxHeight / frame.area();
        if (areaRatio < MIN_AREA_RATIO || areaRatio > MAX_AREA_RATIO
                || boxWidth < width * MIN_SIDE_RATIO || boxHeight < height * MIN_SIDE_RATIO) {
            log.debug("Edge scan rectangle rejected: area ratio {}, {}x{}", areaRatio, boxWidth, boxHeight);
            return Optional.empty();
        }
        return Optional.of(Quadrilateral.ofRectangle(left, top, right, bottom));
    }

    private static int rowEdges(AnalysisFrame frame, int y, int fromX, int toX) {
        int count = 0;
        for (int x = fromX; x < toX; x++) {
            if (frame.gradientAt(x, y) > EDGE_MAGNITUDE) {
                count++;
            }
        }
        return count;
    }

    private static int columnEdges(AnalysisFrame frame, int x, int fromY, int toY) {
        int count = 0;
        for (int y = fromY; y <= toY; y++) {
            if (frame.gradientAt(x, y) > EDGE_MAGNITUDE) {
                count++;
            }
        }
        return count;
    }
}
