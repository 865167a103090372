package com.example.sgkdocumentreader.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Entities pulled from one page of OCR text. Name and national id are only
 * present when they passed the institutional-text filter and the checksum.
 * The phone holds the ten national digits of a mobile number, when one was found.
 */
public record ExtractedEntities(NameCandidate name,
                                NationalIdCandidate nationalId,
                                List<DateCandidate> dates,
                                String phone,
                                String rawText) {

    public ExtractedEntities {
        dates = dates == null ? List.of() : List.copyOf(dates);
        rawText = rawText == null ? "" : rawText;
    }

    public static ExtractedEntities empty(String rawText) {
        return new ExtractedEntities(null, null, List.of(), null, rawText);
    }

    public Optional<NameCandidate> nameCandidate() {
        return Optional.ofNullable(name);
    }

    public Optional<String> validNationalId() {
        return nationalId != null && nationalId.validated() ? Optional.of(nationalId.value()) : Optional.empty();
    }

    /** Labelled birth date, otherwise the first date without a document label. */
    public Optional<LocalDate> birthDate() {
        return dates.stream()
                .filter(date -> date.role() == DateRole.BIRTH)
                .findFirst()
                .or(() -> dates.stream().filter(date -> date.role() == DateRole.UNKNOWN).findFirst())
                .map(DateCandidate::date);
    }

    public boolean hasUsableIdentity() {
        return name != null || validNationalId().isPresent();
    }
}
