package com.example.sgkdocumentreader.service.classification;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.model.ClassificationMethod;
import com.example.sgkdocumentreader.model.ClassificationResult;
import com.example.sgkdocumentreader.model.DocumentType;
import com.example.sgkdocumentreader.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides the document type of a page. An external classifier, when one is
 * configured and confident, wins; otherwise ordered keyword rules are applied
 * and the first rule that matches decides.
 */
@Component
public class DocumentClassifier {

    private static final Logger log = LoggerFactory.getLogger(DocumentClassifier.class);

    private static final Pattern BATTERY = Pattern.compile("(?<![a-z])(pil|batarya)");
    private static final Pattern DEVICE = Pattern.compile("(?<![a-z])(cihaz|isitme)");
    private static final Pattern AUDIOMETRY = Pattern.compile("odyogram|audiogram|odyometri|audiometri");

    private final ExternalDocumentClassifier externalClassifier;
    private final double delegationThreshold;

    @Autowired
    public DocumentClassifier(ObjectProvider<ExternalDocumentClassifier> externalClassifier,
                              PipelineProperties properties) {
        this(externalClassifier.getIfAvailable(), properties.getClassification().getDelegationThreshold());
    }

    DocumentClassifier(ExternalDocumentClassifier externalClassifier, double delegationThreshold) {
        this.externalClassifier = externalClassifier;
        this.delegationThreshold = delegationThreshold;
    }

    public ClassificationResult classify(String text, String fileName) {
        Optional<ClassificationResult> delegated = delegate(text);
        if (delegated.isPresent()) {
            return delegated.get();
        }

        String content = fold(text);
        String name = fold(fileName);
        String haystack = content + " " + name;

        if (haystack.contains("recete")) {
            if (BATTERY.matcher(haystack).find()) {
                return rule(DocumentType.BATTERY_PRESCRIPTION, 0.9);
            }
            if (DEVICE.matcher(haystack).find()) {
                return rule(DocumentType.DEVICE_PRESCRIPTION, 0.9);
            }
            return rule(DocumentType.PRESCRIPTION, 0.8);
        }
        if (AUDIOMETRY.matcher(haystack).find() || name.contains("odyo")) {
            return rule(DocumentType.AUDIOMETRY_REPORT, 0.95);
        }
        if (haystack.contains("uygunluk") || (haystack.contains("rapor") && haystack.contains("sgk"))) {
            return rule(DocumentType.ELIGIBILITY_CERTIFICATE, 0.9);
        }
        if (haystack.contains("muayene") && haystack.contains("rapor")) {
            return rule(DocumentType.MEDICAL_REPORT, 0.85);
        }
        log.debug("No classification rule matched");
        return new ClassificationResult(DocumentType.OTHER, 0.1, ClassificationMethod.DEFAULT);
    }

    private Optional<ClassificationResult> delegate(String text) {
        if (externalClassifier == null) {
            return Optional.empty();
        }
        try {
            Optional<ClassificationResult> result = externalClassifier.classify(text);
            if (result.isPresent() && result.get().confidence() > delegationThreshold) {
                log.debug("Using external classification {}", result.get());
                return Optional.of(new ClassificationResult(result.get().type(), result.get().confidence(),
                        ClassificationMethod.DELEGATED));
            }
        } catch (RuntimeException ex) {
            log.warn("External classifier failed, falling back to keyword rules: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private static ClassificationResult rule(DocumentType type, double confidence) {
        return new ClassificationResult(type, confidence, ClassificationMethod.KEYWORD_RULE);
    }

    private static String fold(String value) {
        if (value == null) {
            return "";
        }
        return TextNormalizer.foldTurkish(value.toLowerCase(TextNormalizer.TURKISH)).toLowerCase(Locale.ROOT);
    }
}
