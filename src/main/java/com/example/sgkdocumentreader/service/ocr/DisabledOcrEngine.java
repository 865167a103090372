package com.example.sgkdocumentreader.service.ocr;

import com.example.sgkdocumentreader.exception.ExtractionFailureException;

/**
 * Installed when OCR is switched off in configuration. Every call fails, so
 * uploads stop at the extraction stage instead of producing empty artifacts.
 */
public class DisabledOcrEngine implements OcrEngine {

    @Override
    public OcrResult extractText(byte[] imageBytes) {
        throw new ExtractionFailureException("OCR is disabled (sgk.ocr.enabled=false)");
    }
}
