package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.BoundingBox;
import com.example.sgkdocumentreader.model.Quadrilateral;

/**
 * Plausibility checks and scoring for detected page outlines.
 */
final class BoundaryScoring {

    static final double MIN_AREA_RATIO = 0.20;
    static final double MAX_AREA_RATIO = 0.95;
    static final double MIN_ASPECT = 0.5;
    static final double MAX_ASPECT = 2.5;
    private static final double RIGHT_ANGLE_TOLERANCE = 15.0;

    private BoundaryScoring() {
    }

    static boolean isPlausible(Quadrilateral quad, int frameWidth, int frameHeight) {
        double areaRatio = quad.area() / ((double) frameWidth * frameHeight);
        if (areaRatio < MIN_AREA_RATIO || areaRatio > MAX_AREA_RATIO) {
            return false;
        }
        double aspect = aspect(quad);
        return aspect >= MIN_ASPECT && aspect <= MAX_ASPECT;
    }

    /**
     * 0.4 for a sensible area, 0.3 for a near-square aspect and up to 0.3 for
     * right-angled corners.
     */
    static double score(Quadrilateral quad, int frameWidth, int frameHeight) {
        double score = 0;
        double areaRatio = quad.area() / ((double) frameWidth * frameHeight);
        if (areaRatio >= 0.2 && areaRatio <= 0.9) {
            score += 0.4;
        }
        double aspect = aspect(quad);
        if (aspect >= 0.7 && aspect <= 1.5) {
            score += 0.3;
        }
        score += 0.3 * rectangularity(quad);
        return score;
    }

    static double rectangularity(Quadrilateral quad) {
        double result = 0;
        for (double angle : quad.cornerAngles()) {
            if (Math.abs(angle - 90.0) <= RIGHT_ANGLE_TOLERANCE) {
                result += 0.25;
            }
        }
        return result;
    }

    private static double aspect(Quadrilateral quad) {
        BoundingBox box = quad.boundingBox();
        return box.width() / (double) box.height();
    }
}
