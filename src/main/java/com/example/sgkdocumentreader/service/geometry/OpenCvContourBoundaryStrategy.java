package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.Point;
import com.example.sgkdocumentreader.model.Quadrilateral;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Canny edges, external contours and polygon approximation. Keeps the largest
 * contour that simplifies to four vertices.
 */
public class OpenCvContourBoundaryStrategy implements BoundaryStrategy {

    private static final Logger log = LoggerFactory.getLogger(OpenCvContourBoundaryStrategy.class);

    private static final double MIN_CONTOUR_AREA_RATIO = 0.1;
    private static final double APPROXIMATION_EPSILON = 0.02;

    private static volatile Boolean available;

    /**
     * Loads the bundled native library once. Returns {@code false} when the
     * platform has no matching binary.
     */
    public static boolean isAvailable() {
        Boolean loaded = available;
        if (loaded == null) {
            synchronized (OpenCvContourBoundaryStrategy.class) {
                loaded = available;
                if (loaded == null) {
                    loaded = load();
                    available = loaded;
                }
            }
        }
        return loaded;
    }

    private static boolean load() {
        try {
            OpenCV.loadLocally();
            log.info("Loaded OpenCV native libraries");
            return true;
        } catch (RuntimeException | LinkageError ex) {
            log.warn("OpenCV native libraries unavailable, contour boundary detection disabled: {}", ex.getMessage());
            return false;
        }
    }

    @Override
    public String name() {
        return "opencv-contour";
    }

    @Override
    public Optional<Quadrilateral> detect(AnalysisFrame frame) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        Mat gray = toMat(frame);
        Mat blurred = new Mat();
        Mat edges = new Mat();
        Mat hierarchy = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            Imgproc.Canny(blurred, edges, 50, 150);
            Imgproc.dilate(edges, edges, kernel);
            Imgproc.findContours(edges, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

            double minimumArea = frame.area() * MIN_CONTOUR_AREA_RATIO;
            return contours.stream()
                    .filter(contour -> Imgproc.contourArea(contour) >= minimumArea)
                    .sorted(Comparator.comparingDouble((MatOfPoint contour) -> Imgproc.contourArea(contour)).reversed())
                    .map(OpenCvContourBoundaryStrategy::approximateQuadrilateral)
                    .flatMap(Optional::stream)
                    .findFirst();
        } finally {
            contours.forEach(Mat::release);
            gray.release();
            blurred.release();
            edges.release();
            hierarchy.release();
            kernel.release();
        }
    }

    private static Optional<Quadrilateral> approximateQuadrilateral(MatOfPoint contour) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        try {
            double perimeter = Imgproc.arcLength(curve, true);
            Imgproc.approxPolyDP(curve, approx, APPROXIMATION_EPSILON * perimeter, true);
            org.opencv.core.Point[] vertices = approx.toArray();
            if (vertices.length != 4) {
                return Optional.empty();
            }
            return Optional.of(orderCorners(vertices));
        } finally {
            curve.release();
            approx.release();
        }
    }

    static Quadrilateral orderCorners(org.opencv.core.Point[] vertices) {
        org.opencv.core.Point topLeft = vertices[0];
        org.opencv.core.Point bottomRight = vertices[0];
        org.opencv.core.Point topRight = vertices[0];
        org.opencv.core.Point bottomLeft = vertices[0];
        for (org.opencv.core.Point vertex : vertices) {
            if (vertex.x + vertex.y < topLeft.x + topLeft.y) {
                topLeft = vertex;
            }
            if (vertex.x + vertex.y > bottomRight.x + bottomRight.y) {
                bottomRight = vertex;
            }
            if (vertex.y - vertex.x < topRight.y - topRight.x) {
                topRight = vertex;
            }
            if (vertex.y - vertex.x > bottomLeft.y - bottomLeft.x) {
                bottomLeft = vertex;
            }
        }
        return new Quadrilateral(toPoint(topLeft), toPoint(topRight), toPoint(bottomRight), toPoint(bottomLeft));
    }

    private static Point toPoint(org.opencv.core.Point point) {
        return new Point((int) Math.round(point.x), (int) Math.round(point.y));
    }

    private static Mat toMat(AnalysisFrame frame) {
        byte[] data = new byte[frame.gray().length];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) frame.gray()[i];
        }
        Mat mat = new Mat(frame.height(), frame.width(), CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }
}
