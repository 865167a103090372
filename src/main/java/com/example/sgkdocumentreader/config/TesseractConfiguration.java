package com.example.sgkdocumentreader.config;

import com.example.sgkdocumentreader.service.ocr.DisabledOcrEngine;
import com.example.sgkdocumentreader.service.ocr.OcrEngine;
import com.example.sgkdocumentreader.service.ocr.TesseractOcrEngine;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.util.LoadLibs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Configuration
public class TesseractConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseractConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "sgk.ocr", name = "enabled", havingValue = "true", matchIfMissing = true)
    public Tesseract tesseract(PipelineProperties properties) {
        String language = properties.getOcr().getLanguage();
        Tesseract tesseract = new Tesseract();
        String resolvedDataPath = resolveDataPath(properties.getOcr().getDatapath(), language);
        if (resolvedDataPath != null) {
            log.info("Configuring Tesseract data path: {}", resolvedDataPath);
        } else {
            File bundled = LoadLibs.extractTessResources("tessdata");
            resolvedDataPath = bundled.getAbsolutePath();
            log.warn("No tessdata directory contains '{}'. Falling back to the data bundled with tess4j at {}. "
                            + "Provide it via sgk.ocr.datapath or the TESSDATA_PREFIX environment variable.",
                    language, resolvedDataPath);
        }
        tesseract.setDatapath(resolvedDataPath);
        tesseract.setLanguage(language);
        tesseract.setOcrEngineMode(1); // LSTM only
        tesseract.setPageSegMode(6); // Assume a block of text
        return tesseract;
    }

    @Bean
    @ConditionalOnProperty(prefix = "sgk.ocr", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OcrEngine tesseractOcrEngine(Tesseract tesseract, PipelineProperties properties) {
        log.info("Tesseract OCR initialized with language: {}", properties.getOcr().getLanguage());
        return new TesseractOcrEngine(tesseract);
    }

    @Bean
    @ConditionalOnProperty(prefix = "sgk.ocr", name = "enabled", havingValue = "false")
    public OcrEngine disabledOcrEngine() {
        log.warn("OCR is disabled; uploads will fail at text extraction");
        return new DisabledOcrEngine();
    }

    static String resolveDataPath(String configured, String language) {
        List<String> candidates = new ArrayList<>();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured);
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }

        candidates.add("/usr/share/tesseract-ocr/5/tessdata");
        candidates.add("/usr/share/tesseract-ocr/4.00/tessdata");
        candidates.add("/usr/share/tessdata");
        candidates.add("C:/Program Files/Tesseract-OCR/tessdata");

        List<String> languages = Arrays.stream(language.split("\\+"))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
        for (String candidate : candidates) {
            Path validPath = validateCandidate(candidate, languages);
            if (validPath != null) {
                return validPath.toString();
            }
        }
        return null;
    }

    private static Path validateCandidate(String candidate, List<String> languages) {
        Path basePath = Paths.get(candidate).normalize();
        if (!Files.isDirectory(basePath)) {
            return null;
        }
        if (containsAll(basePath, languages)) {
            return basePath;
        }
        Path tessdataDirectory = basePath.resolve("tessdata");
        if (Files.isDirectory(tessdataDirectory) && containsAll(tessdataDirectory, languages)) {
            return tessdataDirectory;
        }
        log.debug("Tesseract data path candidate '{}' does not contain {}", candidate, languages);
        return null;
    }

    private static boolean containsAll(Path directory, List<String> languages) {
        return languages.stream().allMatch(lang -> Files.isRegularFile(directory.resolve(lang + ".traineddata")));
    }
}
