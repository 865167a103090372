package com.example.sgkdocumentreader.service.matching;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.model.ExtractedEntities;
import com.example.sgkdocumentreader.model.IdentityResolution;
import com.example.sgkdocumentreader.model.MatchCandidate;
import com.example.sgkdocumentreader.model.MatchMethod;
import com.example.sgkdocumentreader.model.MatchTier;
import com.example.sgkdocumentreader.model.NameCandidate;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.SignalBreakdown;
import com.example.sgkdocumentreader.service.extraction.InstitutionalTextFilter;
import com.example.sgkdocumentreader.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks directory patients against the entities of one page. Holds no state
 * between calls: the same entities and directory snapshot always produce the
 * same candidates in the same order.
 */
@Component
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final double NAME_WEIGHT = 0.80;
    static final double EXACT_WORDS_WEIGHT = 0.15;
    static final double NAME_ORDER_WEIGHT = 0.05;
    static final double NATIONAL_ID_WEIGHT = 0.10;
    static final double BIRTH_DATE_WEIGHT = 0.05;
    static final double PHONE_WEIGHT = 0.02;

    static final double KEYWORD_FULL_CONFIDENCE = 0.95;
    static final double KEYWORD_UNIQUE_TOKEN_CONFIDENCE = 0.30;
    static final double KEYWORD_SHARED_TOKEN_CONFIDENCE = 0.15;

    private static final double NAME_ORDER_TOKEN_SIMILARITY = 0.8;
    private static final int KEYWORD_MIN_LENGTH = 4;
    private static final int PHONE_SUFFIX_DIGITS = 7;

    private static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingDouble(MatchCandidate::confidence).reversed()
            .thenComparing(MatchCandidate::patientId);

    private final double highThreshold;
    private final double mediumThreshold;
    private final double lowThreshold;
    private final int maxCandidates;

    @Autowired
    public IdentityResolver(PipelineProperties properties) {
        this(properties.getMatching().getHighThreshold(),
                properties.getMatching().getMediumThreshold(),
                properties.getMatching().getLowThreshold(),
                properties.getMatching().getMaxCandidates());
    }

    IdentityResolver(double highThreshold, double mediumThreshold, double lowThreshold, int maxCandidates) {
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
        this.lowThreshold = lowThreshold;
        this.maxCandidates = maxCandidates;
    }

    public IdentityResolution resolve(ExtractedEntities entities, List<Patient> patients) {
        Optional<String> name = entities.nameCandidate()
                .map(NameCandidate::text)
                .filter(text -> !InstitutionalTextFilter.isInstitutional(text));
        Optional<String> nationalId = entities.validNationalId();

        List<MatchCandidate> candidates = new ArrayList<>();
        if (name.isPresent() || nationalId.isPresent()) {
            for (Patient patient : patients) {
                if (!isMatchable(patient)) {
                    continue;
                }
                MatchCandidate candidate = score(patient, name.orElse(null), nationalId.orElse(null),
                        entities.birthDate().orElse(null), entities.phone());
                if (candidate.confidence() > 0) {
                    candidates.add(candidate);
                }
            }
        } else {
            log.debug("No usable name or national id, skipping fuzzy matching");
        }

        List<MatchCandidate> ranked = rank(candidates);
        MatchTier tier = tierFor(ranked);
        if (tier == MatchTier.NONE) {
            List<MatchCandidate> keywordMatches = keywordSearch(entities.rawText(), patients);
            if (!keywordMatches.isEmpty()) {
                log.info("Direct keyword search matched {} patient(s)", keywordMatches.size());
                List<MatchCandidate> merged = new ArrayList<>(keywordMatches);
                merged.addAll(ranked);
                ranked = rank(merged);
                tier = tierFor(ranked);
            }
        }
        if (ranked.size() > maxCandidates) {
            ranked = List.copyOf(ranked.subList(0, maxCandidates));
        }
        log.debug("Identity resolution produced {} candidate(s), tier {}", ranked.size(), tier);
        return new IdentityResolution(ranked, tier);
    }

    public MatchTier tierFor(double confidence) {
        if (confidence >= highThreshold) {
            return MatchTier.HIGH;
        }
        if (confidence >= mediumThreshold) {
            return MatchTier.MEDIUM;
        }
        if (confidence >= lowThreshold) {
            return MatchTier.LOW;
        }
        return MatchTier.NONE;
    }

    private MatchTier tierFor(List<MatchCandidate> ranked) {
        return ranked.isEmpty() ? MatchTier.NONE : tierFor(ranked.get(0).confidence());
    }

    private MatchCandidate score(Patient patient, String extractedName, String nationalId,
                                 LocalDate birthDate, String phone) {
        double nameScore = 0;
        double exactWords = 0;
        double nameOrder = 0;
        if (extractedName != null) {
            String extracted = TextNormalizer.normalize(extractedName);
            String known = TextNormalizer.normalize(patient.fullName());
            nameScore = NameSimilarity.combined(extracted, known);
            exactWords = exactWordScore(extracted, known);
            nameOrder = nameOrderScore(extracted, known);
        }
        double idScore = nationalId != null && nationalId.equals(patient.nationalId()) ? 1 : 0;
        double birthScore = birthDate != null && birthDate.equals(patient.birthDate()) ? 1 : 0;
        double phoneScore = phoneMatches(phone, patient.phone()) ? 1 : 0;

        double confidence = nameScore * NAME_WEIGHT
                + exactWords * EXACT_WORDS_WEIGHT
                + nameOrder * NAME_ORDER_WEIGHT
                + idScore * NATIONAL_ID_WEIGHT
                + birthScore * BIRTH_DATE_WEIGHT
                + phoneScore * PHONE_WEIGHT;
        return new MatchCandidate(patient.id(), patient.fullName(), Math.min(1.0, confidence),
                new SignalBreakdown(nameScore, exactWords, nameOrder, idScore, birthScore, phoneScore),
                MatchMethod.FUZZY);
    }

    static double exactWordScore(String extracted, String known) {
        List<String> extractedTokens = TextNormalizer.tokens(extracted);
        List<String> knownTokens = TextNormalizer.tokens(known);
        if (extractedTokens.isEmpty() || knownTokens.isEmpty()) {
            return 0;
        }
        long exact = extractedTokens.stream().filter(knownTokens::contains).count();
        return exact / (double) Math.max(extractedTokens.size(), knownTokens.size());
    }

    static double nameOrderScore(String extracted, String known) {
        List<String> extractedTokens = TextNormalizer.tokens(extracted).stream().filter(t -> t.length() > 1).toList();
        List<String> knownTokens = TextNormalizer.tokens(known).stream().filter(t -> t.length() > 1).toList();
        if (extractedTokens.isEmpty() || extractedTokens.size() != knownTokens.size()) {
            return 0;
        }
        int aligned = 0;
        for (int i = 0; i < extractedTokens.size(); i++) {
            if (NameSimilarity.levenshtein(extractedTokens.get(i), knownTokens.get(i)) > NAME_ORDER_TOKEN_SIMILARITY) {
                aligned++;
            }
        }
        return aligned / (double) extractedTokens.size();
    }

    static boolean phoneMatches(String first, String second) {
        String firstDigits = first == null ? "" : first.replaceAll("\\D", "");
        String secondDigits = second == null ? "" : second.replaceAll("\\D", "");
        if (firstDigits.length() < PHONE_SUFFIX_DIGITS || secondDigits.length() < PHONE_SUFFIX_DIGITS) {
            return false;
        }
        return firstDigits.substring(firstDigits.length() - PHONE_SUFFIX_DIGITS)
                .equals(secondDigits.substring(secondDigits.length() - PHONE_SUFFIX_DIGITS));
    }

    /**
     * Looks for the directory's own name tokens as whole words in the raw OCR
     * text. Two or more hits identify the patient; a single hit counts only as
     * much as it is unique within the directory.
     */
    List<MatchCandidate> keywordSearch(String rawText, List<Patient> patients) {
        Set<String> textTokens = new HashSet<>(TextNormalizer.tokens(TextNormalizer.normalize(rawText)));
        if (textTokens.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> tokenOwners = new HashMap<>();
        Map<Patient, List<String>> keywordsByPatient = new LinkedHashMap<>();
        for (Patient patient : patients) {
            if (!isMatchable(patient)) {
                continue;
            }
            List<String> keywords = TextNormalizer.tokens(TextNormalizer.normalize(patient.fullName())).stream()
                    .filter(token -> token.length() >= KEYWORD_MIN_LENGTH)
                    .distinct()
                    .toList();
            keywordsByPatient.put(patient, keywords);
            keywords.forEach(token -> tokenOwners.merge(token, 1, Integer::sum));
        }

        List<MatchCandidate> matches = new ArrayList<>();
        keywordsByPatient.forEach((patient, keywords) -> {
            List<String> found = keywords.stream().filter(textTokens::contains).toList();
            double confidence;
            if (found.size() >= 2) {
                confidence = KEYWORD_FULL_CONFIDENCE;
            } else if (found.size() == 1) {
                confidence = tokenOwners.get(found.get(0)) == 1
                        ? KEYWORD_UNIQUE_TOKEN_CONFIDENCE
                        : KEYWORD_SHARED_TOKEN_CONFIDENCE;
            } else {
                return;
            }
            matches.add(new MatchCandidate(patient.id(), patient.fullName(), confidence,
                    SignalBreakdown.none(), MatchMethod.KEYWORD_SEARCH));
        });
        return matches;
    }

    private static List<MatchCandidate> rank(List<MatchCandidate> candidates) {
        Map<String, MatchCandidate> unique = new LinkedHashMap<>();
        candidates.stream().sorted(RANKING).forEach(candidate -> unique.putIfAbsent(candidate.patientId(), candidate));
        return List.copyOf(unique.values());
    }

    private static boolean isMatchable(Patient patient) {
        return patient.fullName() != null
                && !patient.fullName().isBlank()
                && !InstitutionalTextFilter.isInstitutional(patient.fullName());
    }
}
