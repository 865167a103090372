package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.Quadrilateral;
import org.junit.jupiter.api.Test;

import static com.example.sgkdocumentreader.service.geometry.EdgeDensityBoundaryStrategyTest.sheet;
import static org.assertj.core.api.Assertions.assertThat;

class BrightnessProfileBoundaryStrategyTest {

    private final BrightnessProfileBoundaryStrategy strategy = new BrightnessProfileBoundaryStrategy();

    @Test
    void shouldPadTheBrightRegion() {
        AnalysisFrame frame = AnalysisFrame.of(sheet(400, 600, 80, 90, 240, 420));

        assertThat(strategy.detect(frame)).contains(Quadrilateral.ofRectangle(70, 80, 329, 519));
    }

    @Test
    void shouldPlaceThresholdAboveTheDarkPeak() {
        assertThat(BrightnessProfileBoundaryStrategy.threshold(AnalysisFrame.of(sheet(400, 600, 80, 90, 240, 420))))
                .isEqualTo(70);
    }

    @Test
    void shouldFallBackToMidGrayWithSinglePeak() {
        assertThat(BrightnessProfileBoundaryStrategy.threshold(AnalysisFrame.of(sheet(100, 100, 0, 0, 100, 100))))
                .isEqualTo(128);
    }

    @Test
    void shouldRejectFrameFilledBySheet() {
        assertThat(strategy.detect(AnalysisFrame.of(sheet(400, 600, 0, 0, 400, 600)))).isEmpty();
    }
}
