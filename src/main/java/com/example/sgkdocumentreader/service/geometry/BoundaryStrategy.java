package com.example.sgkdocumentreader.service.geometry;

import com.example.sgkdocumentreader.model.Quadrilateral;

import java.util.Optional;

/**
 * Locates the outline of a paper page inside a photographed frame.
 * Implementations may use classical gradient scans, brightness profiles or
 * native computer vision; {@link DocumentRectifier} validates and scores
 * whatever they return, so a strategy only needs to report its best guess.
 */
public interface BoundaryStrategy {

    /** Short identifier recorded on the rectified image. */
    String name();

    /**
     * @param frame downscaled analysis frame
     * @return outline in frame coordinates, or empty when nothing plausible was found
     */
    Optional<Quadrilateral> detect(AnalysisFrame frame);
}
