package com.example.sgkdocumentreader.service.ocr;

import com.example.sgkdocumentreader.exception.ExtractionFailureException;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Tess4j-backed engine. A {@link ITesseract} instance is not safe for
 * concurrent use, so calls on one engine are serialized.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;

    public TesseractOcrEngine(ITesseract tesseract) {
        this.tesseract = Objects.requireNonNull(tesseract, "tesseract");
    }

    @Override
    public OcrResult extractText(byte[] imageBytes) {
        BufferedImage image = decode(imageBytes);
        try {
            String raw;
            double confidence;
            synchronized (tesseract) {
                raw = tesseract.doOCR(image);
                confidence = readConfidence(image);
            }
            String text = raw == null ? "" : raw.replace('\u0000', ' ').trim();
            log.debug("OCR read {} characters with confidence {}", text.length(), confidence);
            return new OcrResult(text, confidence);
        } catch (TesseractException ex) {
            String message = String.format(Locale.ROOT, "Tesseract failed to read page: %s", ex.getMessage());
            log.error(message, ex);
            throw new ExtractionFailureException(message, ex);
        } catch (Error ex) {
            if ("Invalid memory access".equalsIgnoreCase(ex.getMessage())) {
                String message = "Tesseract native layer failed. Verify that the tessdata directory contains the configured languages.";
                log.error(message, ex);
                throw new ExtractionFailureException(message, ex);
            }
            throw ex;
        }
    }

    private BufferedImage decode(byte[] imageBytes) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
            if (image == null) {
                throw new ExtractionFailureException("OCR input is not a readable image");
            }
            return image;
        } catch (IOException ex) {
            throw new ExtractionFailureException("Unable to decode OCR input", ex);
        }
    }

    private double readConfidence(BufferedImage image) {
        try {
            List<Word> words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            if (words == null || words.isEmpty()) {
                return 0.0;
            }
            OptionalDouble average = words.stream()
                    .mapToDouble(Word::getConfidence)
                    .filter(value -> value >= 0)
                    .average();
            return average.isPresent() ? average.getAsDouble() / 100.0 : 0.0;
        } catch (RuntimeException ex) {
            log.debug("Tesseract confidence retrieval failed: {}", ex.getMessage());
            return 0.0;
        }
    }
}
