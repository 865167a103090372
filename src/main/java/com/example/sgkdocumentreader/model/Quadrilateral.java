package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Outline of a page inside a photographed frame, corners in clockwise order
 * starting at the top-left one.
 */
@Schema(description = "Detected page outline, corners clockwise from top-left")
public record Quadrilateral(Point topLeft, Point topRight, Point bottomRight, Point bottomLeft) {

    public Quadrilateral {
        Objects.requireNonNull(topLeft, "topLeft");
        Objects.requireNonNull(topRight, "topRight");
        Objects.requireNonNull(bottomRight, "bottomRight");
        Objects.requireNonNull(bottomLeft, "bottomLeft");
    }

    public static Quadrilateral ofRectangle(int left, int top, int right, int bottom) {
        return new Quadrilateral(
                new Point(left, top),
                new Point(right, top),
                new Point(right, bottom),
                new Point(left, bottom));
    }

    public List<Point> corners() {
        return List.of(topLeft, topRight, bottomRight, bottomLeft);
    }

    /** Shoelace area. */
    public double area() {
        List<Point> corners = corners();
        double sum = 0;
        for (int i = 0; i < corners.size(); i++) {
            Point current = corners.get(i);
            Point next = corners.get((i + 1) % corners.size());
            sum += (double) current.x() * next.y() - (double) next.x() * current.y();
        }
        return Math.abs(sum) / 2.0;
    }

    /**
     * Interior angle in degrees at each corner, in the same order as
     * {@link #corners()}.
     */
    public double[] cornerAngles() {
        List<Point> corners = corners();
        double[] angles = new double[corners.size()];
        for (int i = 0; i < corners.size(); i++) {
            Point previous = corners.get((i + corners.size() - 1) % corners.size());
            Point current = corners.get(i);
            Point next = corners.get((i + 1) % corners.size());
            double ax = previous.x() - current.x();
            double ay = previous.y() - current.y();
            double bx = next.x() - current.x();
            double by = next.y() - current.y();
            double lengths = Math.hypot(ax, ay) * Math.hypot(bx, by);
            if (lengths == 0) {
                angles[i] = 0;
                continue;
            }
            double cosine = Math.max(-1.0, Math.min(1.0, (ax * bx + ay * by) / lengths));
            angles[i] = Math.toDegrees(Math.acos(cosine));
        }
        return angles;
    }

    public BoundingBox boundingBox() {
        int minX = Math.min(Math.min(topLeft.x(), topRight.x()), Math.min(bottomRight.x(), bottomLeft.x()));
        int maxX = Math.max(Math.max(topLeft.x(), topRight.x()), Math.max(bottomRight.x(), bottomLeft.x()));
        int minY = Math.min(Math.min(topLeft.y(), topRight.y()), Math.min(bottomRight.y(), bottomLeft.y()));
        int maxY = Math.max(Math.max(topLeft.y(), topRight.y()), Math.max(bottomRight.y(), bottomLeft.y()));
        return new BoundingBox(minX, minY, Math.max(1, maxX - minX), Math.max(1, maxY - minY));
    }

    public Quadrilateral scale(double factor) {
        return new Quadrilateral(topLeft.scale(factor), topRight.scale(factor),
                bottomRight.scale(factor), bottomLeft.scale(factor));
    }
}
