package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.Point;
import com.example.sgkdocumentreader.model.Quadrilateral;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class OpenCvContourBoundaryStrategyTest {

    @Test
    void shouldOrderCornersClockwiseFromTopLeft() {
        org.opencv.core.Point[] vertices = {
                new org.opencv.core.Point(90, 95),
                new org.opencv.core.Point(10, 12),
                new org.opencv.core.Point(8, 90),
                new org.opencv.core.Point(92, 10)
        };

        Quadrilateral quad = OpenCvContourBoundaryStrategy.orderCorners(vertices);

        assertThat(quad.topLeft()).isEqualTo(new Point(10, 12));
        assertThat(quad.topRight()).isEqualTo(new Point(92, 10));
        assertThat(quad.bottomRight()).isEqualTo(new Point(90, 95));
        assertThat(quad.bottomLeft()).isEqualTo(new Point(8, 90));
    }

    @Test
    void shouldFindPageOutlineWhenNativeLibraryIsAvailable() {
        assumeTrue(OpenCvContourBoundaryStrategy.isAvailable(), "OpenCV native library not available");
        BufferedImage image = new BufferedImage(400, 300, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.DARK_GRAY);
        g.fillRect(0, 0, 400, 300);
        g.setColor(Color.WHITE);
        g.fillRect(80, 50, 240, 200);
        g.dispose();

        Optional<Quadrilateral> detected = new OpenCvContourBoundaryStrategy().detect(AnalysisFrame.of(image));

        assertThat(detected).hasValueSatisfying(quad -> {
            assertThat(quad.area()).isBetween(0.3 * 400 * 300, 0.6 * 400 * 300);
            assertThat(BoundaryScoring.rectangularity(quad)).isEqualTo(1.0);
        });
    }
}
