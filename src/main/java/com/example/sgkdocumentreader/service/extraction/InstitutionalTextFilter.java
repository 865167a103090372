package com.example.sgkdocumentreader.service.extraction;

import com.example.sgkdocumentreader.util.TextNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognises hospital, ministry, company and form vocabulary so that
 * letterheads and field labels are never mistaken for a patient name.
 * Matching is per token: a token is institutional when it equals a keyword
 * or a keyword followed by a common Turkish case or possessive ending.
 */
public final class InstitutionalTextFilter {

    private static final Set<String> KEYWORDS = Set.of(
            "KURUMU", "KURUM", "HASTANE", "HOSPITAL", "SAGLIK", "HEALTH", "MEDICAL",
            "SOSYAL", "SOCIAL", "GUVENLIK", "SECURITY", "DEVLET", "STATE", "KAMU", "PUBLIC",
            "BAKANLIGI", "BAKANLIK", "MINISTRY", "MUDURLUGU", "MUDURLUK", "DIRECTORATE",
            "UNIVERSITE", "UNIVERSITY", "FAKULTE", "FACULTY", "BOLUM", "DEPARTMENT",
            "MERKEZ", "CENTER", "CENTRE", "ENSTITU", "INSTITUTE", "VAKIF", "VAKFI", "FOUNDATION",
            "DOKTOR", "DOCTOR", "DR", "HEKIM", "PHYSICIAN", "MUDUR", "MANAGER", "DIRECTOR",
            "SORUMLU", "RESPONSIBLE", "FILIA", "ODYOLOG", "AUDIOLOGIST", "TEKNISYEN", "TECHNICIAN",
            "HEMSIRE", "NURSE", "ASISTAN", "ASSISTANT", "UZMAN", "SPECIALIST", "PROF", "PROFESSOR",
            "KULLANICISI", "USER", "CLIENT", "CUSTOMER", "LTD", "LIMITED", "STI", "ANONIM",
            "SIRKET", "SIRKETI", "COMPANY", "CORPORATION", "FIRMA", "BUSINESS", "TIBBI", "CIHAZLAR",
            "DEVICES", "EQUIPMENT", "RAPOR", "REPORT", "BELGE", "DOCUMENT", "FORM", "FORMUL",
            "BASVURU", "APPLICATION", "ONAY", "APPROVAL", "ONAYLI", "APPROVED", "RUHSAT",
            "LICENSE", "IZIN", "PERMIT", "RECETE", "PRESCRIPTION", "ODYOGRAM", "AUDIOGRAM");

    private static final List<String> ENDINGS = List.of(
            "", "I", "U", "SI", "SU", "NIN", "NUN", "IN", "UN", "E", "A", "DE", "DA", "LARI", "LERI");

    private static final List<Pattern> PHRASES = List.of(
            Pattern.compile("SOSYAL\\s+GUVENLIK"),
            Pattern.compile("DEVLET\\s+HASTANE"),
            Pattern.compile("SAGLIK\\s+BAKANLIGI"),
            Pattern.compile("TIBBI\\s+CIHAZ"));

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^A-Z]+");

    private InstitutionalTextFilter() {
    }

    public static boolean isInstitutional(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String folded = TextNormalizer.foldTurkish(text.toUpperCase(TextNormalizer.TURKISH)).toUpperCase(Locale.ROOT);
        for (Pattern phrase : PHRASES) {
            if (phrase.matcher(folded).find()) {
                return true;
            }
        }
        for (String token : TOKEN_SPLIT.split(folded)) {
            if (!token.isEmpty() && isInstitutionalToken(token)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isInstitutionalToken(String token) {
        for (String ending : ENDINGS) {
            if (token.length() > ending.length() && token.endsWith(ending)
                    && KEYWORDS.contains(token.substring(0, token.length() - ending.length()))) {
                return true;
            }
        }
        return false;
    }
}
