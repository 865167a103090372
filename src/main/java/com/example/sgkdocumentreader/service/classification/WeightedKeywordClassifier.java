package com.example.sgkdocumentreader.service.classification;

import com.example.sgkdocumentreader.model.ClassificationMethod;
import com.example.sgkdocumentreader.model.ClassificationResult;
import com.example.sgkdocumentreader.model.DocumentType;
import com.example.sgkdocumentreader.util.TextNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores every document type by weighted keyword hits instead of taking the
 * first matching rule. Confidence is {@code score / 20} plus up to 0.3 for the
 * share of distinct keywords seen, capped at 1.
 */
public class WeightedKeywordClassifier implements ExternalDocumentClassifier {

    private static final List<TypeKeywords> TYPES = List.of(
            new TypeKeywords(DocumentType.DEVICE_PRESCRIPTION, List.of(
                    new Keyword("isitme cihazi", 5), new Keyword("hearing aid", 5), new Keyword("cihaz recete", 5),
                    new Keyword("protez", 3), new Keyword("aparey", 3))),
            new TypeKeywords(DocumentType.BATTERY_PRESCRIPTION, List.of(
                    new Keyword("pil", 4), new Keyword("batarya", 3), new Keyword("battery", 3),
                    new Keyword("pil recete", 5), new Keyword("isitme cihazi pili", 5))),
            new TypeKeywords(DocumentType.AUDIOMETRY_REPORT, List.of(
                    new Keyword("odyogram", 5), new Keyword("audiogram", 5), new Keyword("isitme testi", 4),
                    new Keyword("hearing test", 4), new Keyword("audiometri", 4), new Keyword("tone audiometry", 4))),
            new TypeKeywords(DocumentType.ELIGIBILITY_CERTIFICATE, List.of(
                    new Keyword("uygunluk belgesi", 5), new Keyword("uygunluk", 3), new Keyword("saglik raporu", 4),
                    new Keyword("hekim raporu", 4), new Keyword("doktor raporu", 4), new Keyword("tibbi rapor", 4))),
            new TypeKeywords(DocumentType.MEDICAL_REPORT, List.of(
                    new Keyword("sgk", 4), new Keyword("s.g.k", 4), new Keyword("sosyal guvenlik", 3),
                    new Keyword("sosyal guvenlik kurumu", 5))),
            new TypeKeywords(DocumentType.PRESCRIPTION, List.of(
                    new Keyword("recete", 3), new Keyword("prescription", 2), new Keyword("ilac", 2),
                    new Keyword("doktor", 2), new Keyword("dr.", 2), new Keyword("hastane", 1))),
            new TypeKeywords(DocumentType.IDENTITY_CARD, List.of(
                    new Keyword("kimlik", 3), new Keyword("tc", 3), new Keyword("t.c", 3),
                    new Keyword("nufus", 2), new Keyword("vatandaslik", 2))));

    @Override
    public Optional<ClassificationResult> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String folded = TextNormalizer.foldTurkish(text.toLowerCase(TextNormalizer.TURKISH)).toLowerCase(Locale.ROOT);
        DocumentType bestType = null;
        double bestConfidence = 0;
        for (TypeKeywords type : TYPES) {
            int score = 0;
            int distinct = 0;
            for (Keyword keyword : type.keywords()) {
                int hits = occurrences(folded, keyword.text());
                if (hits > 0) {
                    score += hits * keyword.weight();
                    distinct++;
                }
            }
            if (distinct == 0) {
                continue;
            }
            double confidence = score / 20.0 + (distinct / (double) type.keywords().size()) * 0.3;
            if (confidence > bestConfidence) {
                bestConfidence = confidence;
                bestType = type.type();
            }
        }
        if (bestType == null) {
            return Optional.empty();
        }
        return Optional.of(new ClassificationResult(bestType, Math.min(1.0, bestConfidence), ClassificationMethod.DELEGATED));
    }

    static int occurrences(String text, String keyword) {
        int count = 0;
        int index = text.indexOf(keyword);
        while (index >= 0) {
            count++;
            index = text.indexOf(keyword, index + keyword.length());
        }
        return count;
    }

    private record Keyword(String text, int weight) {
    }

    private record TypeKeywords(DocumentType type, List<Keyword> keywords) {
    }
}
