package com.example.sgkdocumentreader.service.ocr;

/**
 * Text recognition collaborator. Implementations signal failure with an
 * unchecked exception, which the pipeline treats as an extraction failure.
 */
public interface OcrEngine {

    /**
     * @param imageBytes encoded page image (PNG)
     */
    OcrResult extractText(byte[] imageBytes);
}
