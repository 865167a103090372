package com.example.sgkdocumentreader.service.packaging;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.model.DocumentType;
import com.example.sgkdocumentreader.model.MatchTier;
import com.example.sgkdocumentreader.util.TextNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds {@code PATIENT_TypeLabel[_CHECK]_yyyyMMdd_HHmm[indicator].pdf}. The
 * indicator tells the reviewer how much to trust the patient link.
 */
@Component
public class FilenameGenerator {

    static final String UNKNOWN_PATIENT = "BILINMEYEN_HASTA";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm", Locale.ROOT);
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;
    private final double checkThreshold;

    @Autowired
    public FilenameGenerator(Clock clock, PipelineProperties properties) {
        this(clock, properties.getClassification().getCheckThreshold());
    }

    FilenameGenerator(Clock clock, double checkThreshold) {
        this.clock = clock;
        this.checkThreshold = checkThreshold;
    }

    public String generate(String patientName, DocumentType type, double classificationConfidence,
                           MatchTier tier, boolean nameExtracted) {
        String patient = sanitize(patientName);
        if (patient.isEmpty()) {
            patient = UNKNOWN_PATIENT;
        }
        String typePart = type.fileLabel() + (classificationConfidence < checkThreshold ? "_CHECK" : "");
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return patient + "_" + typePart + "_" + timestamp + indicator(tier, nameExtracted) + ".pdf";
    }

    static String indicator(MatchTier tier, boolean nameExtracted) {
        return switch (tier) {
            case HIGH -> "";
            case MEDIUM -> "_VERIFY";
            case LOW -> "_MANUAL";
            case NONE -> nameExtracted ? "_UNMATCHED" : "";
        };
    }

    static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String ascii = UNSAFE.matcher(TextNormalizer.foldTurkish(name)).replaceAll("").trim();
        return WHITESPACE.matcher(ascii).replaceAll("_").toUpperCase(Locale.ROOT);
    }
}
