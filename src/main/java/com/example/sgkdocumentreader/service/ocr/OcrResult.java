package com.example.sgkdocumentreader.service.ocr;

/**
 * @param text       recognised text, never null
 * @param confidence mean word confidence between 0 and 1
 */
public record OcrResult(String text, double confidence) {

    public OcrResult {
        text = text == null ? "" : text;
        confidence = Double.isFinite(confidence) ? Math.max(0.0, Math.min(1.0, confidence)) : 0.0;
    }
}
