package com.example.sgkdocumentreader.config;

import com.example.sgkdocumentreader.service.geometry.BoundaryStrategy;
import com.example.sgkdocumentreader.service.geometry.BrightnessProfileBoundaryStrategy;
import com.example.sgkdocumentreader.service.geometry.EdgeDensityBoundaryStrategy;
import com.example.sgkdocumentreader.service.geometry.OpenCvContourBoundaryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * Boundary strategies handed to the rectifier in order. The OpenCV strategy
 * stays silent when the native library does not load on this machine.
 */
@Configuration
public class BoundaryDetectionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BoundaryDetectionConfiguration.class);

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "sgk.rectifier", name = "opencv-enabled", havingValue = "true", matchIfMissing = true)
    public BoundaryStrategy openCvContourBoundaryStrategy() {
        if (!OpenCvContourBoundaryStrategy.isAvailable()) {
            log.info("OpenCV native library unavailable, relying on pure Java boundary detection");
        }
        return new OpenCvContourBoundaryStrategy();
    }

    @Bean
    @Order(2)
    public BoundaryStrategy edgeDensityBoundaryStrategy(PipelineProperties properties) {
        return new EdgeDensityBoundaryStrategy(properties.getRectifier().getEdgeDensityFraction(),
                properties.getRectifier().getMarginFraction());
    }

    @Bean
    @Order(3)
    public BoundaryStrategy brightnessProfileBoundaryStrategy() {
        return new BrightnessProfileBoundaryStrategy();
    }
}
