package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.model.BoundingBox;
import com.example.sgkdocumentreader.model.Quadrilateral;
import com.example.sgkdocumentreader.model.RectifiedImage;
import com.example.sgkdocumentreader.util.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Finds the page inside a photographed frame and crops to it. Every strategy
 * proposes an outline on a downscaled copy; the best plausible outline above
 * the score threshold is mapped back to full resolution. When none qualifies
 * a uniform margin is trimmed instead. This never throws.
 */
@Service
public class DocumentRectifier {

    private static final Logger log = LoggerFactory.getLogger(DocumentRectifier.class);

    static final String MARGIN_TRIM = "margin-trim";

    private final List<BoundaryStrategy> strategies;
    private final int maxAnalysisDimension;
    private final double marginFraction;
    private final double minimumScore;

    @Autowired
    public DocumentRectifier(List<BoundaryStrategy> strategies, PipelineProperties properties) {
        this(strategies,
                properties.getRectifier().getMaxAnalysisDimension(),
                properties.getRectifier().getMarginFraction(),
                properties.getRectifier().getMinimumScore());
    }

    DocumentRectifier(List<BoundaryStrategy> strategies, int maxAnalysisDimension,
                      double marginFraction, double minimumScore) {
        this.strategies = List.copyOf(strategies);
        this.maxAnalysisDimension = maxAnalysisDimension;
        this.marginFraction = marginFraction;
        this.minimumScore = minimumScore;
    }

    public RectifiedImage rectify(BufferedImage source) {
        try {
            return detectAndCrop(source);
        } catch (RuntimeException ex) {
            log.warn("Boundary detection failed, trimming margins instead: {}", ex.getMessage());
            return trimMargins(source);
        }
    }

    private RectifiedImage detectAndCrop(BufferedImage source) {
        BufferedImage analysis = ImagePreprocessor.scaleToMaxDimension(source, maxAnalysisDimension);
        double scale = analysis.getWidth() / (double) source.getWidth();
        AnalysisFrame frame = AnalysisFrame.of(analysis);

        Candidate best = null;
        for (BoundaryStrategy strategy : strategies) {
            Optional<Quadrilateral> detected = safeDetect(strategy, frame);
            if (detected.isEmpty()) {
                continue;
            }
            Quadrilateral quad = detected.get();
            if (!BoundaryScoring.isPlausible(quad, frame.width(), frame.height())) {
                log.debug("Strategy {} proposed an implausible outline {}", strategy.name(), quad);
                continue;
            }
            double score = BoundaryScoring.score(quad, frame.width(), frame.height());
            log.debug("Strategy {} scored {}", strategy.name(), score);
            if (best == null || score > best.score()) {
                best = new Candidate(strategy.name(), quad, score);
            }
        }

        if (best == null || best.score() <= minimumScore) {
            log.info("No confident page boundary found, trimming margins");
            return trimMargins(source);
        }

        Quadrilateral boundary = best.quad().scale(1.0 / scale);
        BoundingBox box = boundary.boundingBox().clampTo(source.getWidth(), source.getHeight());
        log.info("Page boundary found by {} (score {}), cropping to {}", best.strategy(), best.score(), box);
        return new RectifiedImage(ImagePreprocessor.crop(source, box), true, boundary, best.strategy());
    }

    private Optional<Quadrilateral> safeDetect(BoundaryStrategy strategy, AnalysisFrame frame) {
        try {
            return strategy.detect(frame);
        } catch (RuntimeException | LinkageError ex) {
            log.warn("Boundary strategy {} failed: {}", strategy.name(), ex.getMessage());
            return Optional.empty();
        }
    }

    private RectifiedImage trimMargins(BufferedImage source) {
        int margin = (int) (Math.min(source.getWidth(), source.getHeight()) * marginFraction);
        if (margin <= 0) {
            return new RectifiedImage(source, false, null, MARGIN_TRIM);
        }
        BoundingBox box = new BoundingBox(margin, margin,
                source.getWidth() - 2 * margin, source.getHeight() - 2 * margin);
        return new RectifiedImage(ImagePreprocessor.crop(source, box), false, null, MARGIN_TRIM);
    }

    private record Candidate(String strategy, Quadrilateral quad, double score) {
    }
}
