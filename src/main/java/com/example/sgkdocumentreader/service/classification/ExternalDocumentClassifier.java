package com.example.sgkdocumentreader.service.classification;

import com.example.sgkdocumentreader.model.ClassificationResult;

import java.util.Optional;

/**
 * Optional smarter classifier consulted before the built-in keyword rules.
 * Its answer is used only when it is confident enough; an empty result or
 * an exception falls through to the rules.
 */
public interface ExternalDocumentClassifier {

    Optional<ClassificationResult> classify(String text);
}
