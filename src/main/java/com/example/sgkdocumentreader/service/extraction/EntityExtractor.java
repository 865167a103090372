package com.example.sgkdocumentreader.service.extraction;

import com.example.sgkdocumentreader.model.DateCandidate;
import com.example.sgkdocumentreader.model.DateRole;
import com.example.sgkdocumentreader.model.ExtractedEntities;
import com.example.sgkdocumentreader.model.NameCandidate;
import com.example.sgkdocumentreader.model.NationalIdCandidate;
import com.example.sgkdocumentreader.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the patient name, national id and dates out of raw OCR text. Names
 * and ids that fail the institutional-text filter or the checksum are dropped
 * here and never reach identity resolution.
 */
@Component
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private static final String UPPER = "[A-ZÇĞİÖŞÜÂÎÛ]";
    private static final String LETTER = "\\p{L}";
    private static final String GAP = "[ \\t]+";

    private static final List<Pattern> NAME_PATTERNS = List.of(
            Pattern.compile("(?<!" + LETTER + ")(" + UPPER + "{2,}(?:" + GAP + UPPER + "{2,}){1,2})(?!" + LETTER + ")"),
            Pattern.compile("(?:hasta" + GAP + ")?ad[ıi]?" + GAP + "soyad[ıi]?[ \\t]*:?[ \\t]*("
                            + LETTER + "+(?:" + GAP + LETTER + "+){1,3})",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile(":[ \\t]*(\\p{Lu}" + LETTER + "+(?:" + GAP + "\\p{Lu}" + LETTER + "+){1,2})"),
            Pattern.compile("(?<!" + LETTER + ")(\\p{Lu}\\p{Ll}+(?:" + GAP + "\\p{Lu}\\p{Ll}+){1,2})(?!" + LETTER + ")"));

    private static final List<List<String>> LABEL_PREFIXES = List.of(
            List.of("hasta", "adi", "soyadi"),
            List.of("hasta", "ad", "soyad"),
            List.of("adi", "soyadi"),
            List.of("ad", "soyad"),
            List.of("soyadi"),
            List.of("soyad"),
            List.of("adi"),
            List.of("ad"),
            List.of("hasta"),
            List.of("sayin"));

    private static final Set<String> LABEL_SUFFIXES = Set.of(
            "cinsiyeti", "cinsiyet", "dogum", "dogyum", "tarihi", "tarih", "tarihl", "erkek", "kadin",
            "male", "female", "teslim", "kub", "tc", "no");

    private static final Set<String> CONTEXT_KEYWORDS = Set.of(
            "hasta", "patient", "ad", "adi", "name", "sayin", "bay", "bayan");

    private static final List<String> TURKISH_NAME_ENDINGS = List.of(
            "an", "en", "in", "un", "ay", "ey", "iye", "can", "han", "gul");

    private static final int CONTEXT_WINDOW = 50;
    private static final int DATE_LABEL_WINDOW = 30;

    private static final List<Pattern> NATIONAL_ID_PATTERNS = List.of(
            Pattern.compile("(?:T\\.?[ \\t]?C\\.?(?:[ \\t]*Kimlik)?(?:[ \\t]*No)?|TCKN|Kimlik[ \\t]*No)[ \\t]*[:.]?[ \\t]*(\\d{11})(?!\\d)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("(?<!\\d)(\\d{11})(?!\\d)"));

    private static final Pattern MOBILE_PHONE = Pattern.compile(
            "(?<!\\d)(?:\\+?90[ \\t]?)?0?[ \\t]?\\(?(5\\d{2})\\)?[ \\t]?(\\d{3})[ \\t]?(\\d{2})[ \\t]?(\\d{2})(?!\\d)");

    private static final Pattern DAY_FIRST_DATE = Pattern.compile("(?<!\\d)(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4})(?!\\d)");
    private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)");

    public ExtractedEntities extract(String ocrText) {
        String text = ocrText == null ? "" : ocrText;
        if (text.isBlank()) {
            return ExtractedEntities.empty(text);
        }
        NameCandidate name = extractName(text);
        NationalIdCandidate nationalId = extractNationalId(text);
        List<DateCandidate> dates = extractDates(text);
        String phone = extractPhone(text);
        log.debug("Extracted name={}, nationalId present={}, {} dates",
                name != null ? name.text() : null, nationalId != null, dates.size());
        return new ExtractedEntities(name, nationalId, dates, phone, text);
    }

    NameCandidate extractName(String text) {
        ScoredName best = null;
        Set<String> seen = new LinkedHashSet<>();
        for (Pattern pattern : NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String cleaned = cleanName(matcher.group(1));
                if (cleaned.isEmpty() || !isValidName(cleaned)) {
                    continue;
                }
                String display = toDisplayCase(cleaned);
                if (!seen.add(TextNormalizer.normalize(display))) {
                    continue;
                }
                int score = scoreName(display, text, matcher.start(1), matcher.end(1));
                if (best == null || score > best.score()) {
                    best = new ScoredName(display, score);
                }
            }
        }
        if (best == null) {
            return null;
        }
        return new NameCandidate(best.text(), Math.min(1.0, Math.max(0, best.score()) / 20.0));
    }

    static String cleanName(String raw) {
        if (raw == null) {
            return "";
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(raw.trim().split("\\s+")));
        boolean stripped = true;
        while (stripped && !tokens.isEmpty()) {
            stripped = false;
            for (List<String> prefix : LABEL_PREFIXES) {
                if (startsWith(tokens, prefix)) {
                    tokens.subList(0, prefix.size()).clear();
                    stripped = true;
                    break;
                }
            }
        }
        while (!tokens.isEmpty() && LABEL_SUFFIXES.contains(fold(tokens.get(tokens.size() - 1)))) {
            tokens.remove(tokens.size() - 1);
        }
        String cleaned = String.join(" ", tokens).trim();
        return cleaned.length() < 4 ? "" : cleaned;
    }

    static boolean isValidName(String candidate) {
        String[] tokens = candidate.split("\\s+");
        if (tokens.length < 2 || tokens.length > 4) {
            return false;
        }
        for (String token : tokens) {
            if (token.length() < 2 || !token.chars().allMatch(Character::isLetter)) {
                return false;
            }
        }
        return !InstitutionalTextFilter.isInstitutional(candidate);
    }

    private static int scoreName(String name, String text, int start, int end) {
        String[] tokens = name.split("\\s+");
        int score = switch (tokens.length) {
            case 2 -> 10;
            case 3 -> 8;
            default -> 5;
        };
        String before = text.substring(Math.max(0, start - CONTEXT_WINDOW), start);
        String after = text.substring(end, Math.min(text.length(), end + CONTEXT_WINDOW));
        if (containsContextKeyword(before)) {
            score += 5;
        } else if (containsContextKeyword(after)) {
            score += 3;
        }
        for (String token : tokens) {
            String folded = fold(token);
            if (TURKISH_NAME_ENDINGS.stream().anyMatch(folded::endsWith)) {
                score += 5;
                break;
            }
        }
        if (name.length() < 6) {
            score -= 2;
        } else if (name.length() > 30) {
            score -= 3;
        }
        return score;
    }

    private static boolean containsContextKeyword(String window) {
        return TextNormalizer.tokens(TextNormalizer.normalize(window)).stream().anyMatch(CONTEXT_KEYWORDS::contains);
    }

    private static String toDisplayCase(String name) {
        if (name.equals(name.toUpperCase(TextNormalizer.TURKISH)) || name.equals(name.toLowerCase(TextNormalizer.TURKISH))) {
            return TextNormalizer.toProperCase(name);
        }
        return name;
    }

    NationalIdCandidate extractNationalId(String text) {
        for (Pattern pattern : NATIONAL_ID_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String value = matcher.group(1);
                if (NationalIdValidator.isValid(value)) {
                    return new NationalIdCandidate(value, true);
                }
                log.debug("Discarding 11-digit number with invalid checksum");
            }
        }
        return null;
    }

    String extractPhone(String text) {
        Matcher matcher = MOBILE_PHONE.matcher(text);
        if (matcher.find()) {
            return matcher.group(1) + matcher.group(2) + matcher.group(3) + matcher.group(4);
        }
        return null;
    }

    List<DateCandidate> extractDates(String text) {
        List<PositionedDate> found = new ArrayList<>();
        Matcher dayFirst = DAY_FIRST_DATE.matcher(text);
        while (dayFirst.find()) {
            toDate(dayFirst.group(3), dayFirst.group(2), dayFirst.group(1))
                    .ifPresentOrElse(
                            date -> found.add(new PositionedDate(dayFirst.start(),
                                    new DateCandidate(dayFirst.group(), date, roleFor(text, dayFirst.start())))),
                            () -> log.debug("Ignoring impossible date {}", dayFirst.group()));
        }
        Matcher iso = ISO_DATE.matcher(text);
        while (iso.find()) {
            toDate(iso.group(1), iso.group(2), iso.group(3))
                    .ifPresent(date -> found.add(new PositionedDate(iso.start(),
                            new DateCandidate(iso.group(), date, roleFor(text, iso.start())))));
        }
        found.sort(Comparator.comparingInt(PositionedDate::position));
        return found.stream().map(PositionedDate::candidate).toList();
    }

    private static Optional<LocalDate> toDate(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException | NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static DateRole roleFor(String text, int start) {
        String label = fold(text.substring(Math.max(0, start - DATE_LABEL_WINDOW), start));
        if (label.contains("dogum") || label.contains("birth") || label.contains("d.tarihi") || label.contains("d. tarihi")) {
            return DateRole.BIRTH;
        }
        if (label.contains("rapor") || label.contains("recete") || label.contains("tarih") || label.contains("duzenleme")) {
            return DateRole.DOCUMENT;
        }
        return DateRole.UNKNOWN;
    }

    private static boolean startsWith(List<String> tokens, List<String> prefix) {
        if (tokens.size() < prefix.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!fold(tokens.get(i)).equals(prefix.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static String fold(String value) {
        return TextNormalizer.foldTurkish(value.toLowerCase(TextNormalizer.TURKISH))
                .toLowerCase(Locale.ROOT)
                .replaceAll("[:.,;]+$", "");
    }

    private record ScoredName(String text, int score) {
    }

    private record PositionedDate(int position, DateCandidate candidate) {
    }
}
