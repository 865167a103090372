package com.example.sgkdocumentreader.service.matching;

import com.example.sgkdocumentreader.model.ExtractedEntities;
import com.example.sgkdocumentreader.model.IdentityResolution;
import com.example.sgkdocumentreader.model.MatchCandidate;
import com.example.sgkdocumentreader.model.MatchMethod;
import com.example.sgkdocumentreader.model.MatchTier;
import com.example.sgkdocumentreader.model.NameCandidate;
import com.example.sgkdocumentreader.model.NationalIdCandidate;
import com.example.sgkdocumentreader.model.Patient;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityResolverTest {

    private final IdentityResolver resolver = new IdentityResolver(0.40, 0.25, 0.15, 5);

    private final List<Patient> patients = List.of(
            Patient.of("p-1", "Ali Veli", "12345678950", LocalDate.of(1958, 4, 12), "5321234567"),
            Patient.of("p-2", "Ayşe Demir", "10000000146", null, null),
            Patient.of("p-3", "Mehmet Kaya", null, null, null),
            Patient.of("p-4", "Mehmet Öztürk", null, null, null));

    @Test
    void shouldResolveExactNameAndIdToHighTier() {
        ExtractedEntities entities = new ExtractedEntities(new NameCandidate("Ali Veli", 0.5),
                new NationalIdCandidate("12345678950", true), List.of(), null, "ALİ VELİ\nTC: 12345678950");

        IdentityResolution resolution = resolver.resolve(entities, patients);

        assertThat(resolution.tier()).isEqualTo(MatchTier.HIGH);
        assertThat(resolution.best()).hasValueSatisfying(best -> {
            assertThat(best.patientId()).isEqualTo("p-1");
            assertThat(best.confidence()).isEqualTo(1.0);
            assertThat(best.method()).isEqualTo(MatchMethod.FUZZY);
            assertThat(best.signals().nationalId()).isEqualTo(1.0);
        });
    }

    @Test
    void shouldReturnNoneWithoutUsableIdentityOrKeywords() {
        IdentityResolution resolution = resolver.resolve(ExtractedEntities.empty("SOSYAL GÜVENLİK KURUMU"), patients);

        assertThat(resolution.tier()).isEqualTo(MatchTier.NONE);
        assertThat(resolution.candidates()).isEmpty();
    }

    @Test
    void shouldNotLinkOnNationalIdAlone() {
        ExtractedEntities entities = new ExtractedEntities(null, new NationalIdCandidate("12345678950", true),
                List.of(), null, "TC 12345678950");

        IdentityResolution resolution = resolver.resolve(entities, patients);

        assertThat(resolution.tier()).isEqualTo(MatchTier.NONE);
        assertThat(resolution.best()).hasValueSatisfying(best -> assertThat(best.patientId()).isEqualTo("p-1"));
    }

    @Test
    void shouldFallBackToKeywordSearchWhenNoNameWasExtracted() {
        IdentityResolution resolution = resolver.resolve(
                ExtractedEntities.empty("rapor sahibi ayse demir icin duzenlenmistir"), patients);

        assertThat(resolution.tier()).isEqualTo(MatchTier.HIGH);
        assertThat(resolution.best()).hasValueSatisfying(best -> {
            assertThat(best.patientId()).isEqualTo("p-2");
            assertThat(best.method()).isEqualTo(MatchMethod.KEYWORD_SEARCH);
            assertThat(best.confidence()).isEqualTo(IdentityResolver.KEYWORD_FULL_CONFIDENCE);
        });
    }

    @Test
    void shouldDiscountKeywordsSharedByManyPatients() {
        IdentityResolution shared = resolver.resolve(ExtractedEntities.empty("mehmet"), patients);
        IdentityResolution unique = resolver.resolve(ExtractedEntities.empty("ozturk"), patients);

        assertThat(shared.tier()).isEqualTo(MatchTier.LOW);
        assertThat(shared.candidates()).extracting(MatchCandidate::patientId).containsExactly("p-3", "p-4");
        assertThat(unique.tier()).isEqualTo(MatchTier.MEDIUM);
        assertThat(unique.confidence()).isEqualTo(IdentityResolver.KEYWORD_UNIQUE_TOKEN_CONFIDENCE);
    }

    @Test
    void shouldBeDeterministicForTheSameInputs() {
        ExtractedEntities entities = new ExtractedEntities(new NameCandidate("Mehmet Kayo", 0.5), null,
                List.of(), null, "Mehmet Kayo");

        IdentityResolution first = resolver.resolve(entities, patients);
        IdentityResolution second = resolver.resolve(entities, patients);

        assertThat(second).isEqualTo(first);
        assertThat(first.best()).hasValueSatisfying(best -> assertThat(best.patientId()).isEqualTo("p-3"));
    }

    @Test
    void shouldCapTheNumberOfCandidates() {
        IdentityResolver narrow = new IdentityResolver(0.40, 0.25, 0.15, 2);
        ExtractedEntities entities = new ExtractedEntities(new NameCandidate("Mehmet Kaya", 0.5), null,
                List.of(), null, "Mehmet Kaya");

        assertThat(narrow.resolve(entities, patients).candidates()).hasSizeLessThanOrEqualTo(2);
    }

    @Test
    void shouldSkipInstitutionalDirectoryEntries() {
        List<Patient> directory = List.of(Patient.of("inst", "Devlet Hastanesi", null, null, null));
        ExtractedEntities entities = ExtractedEntities.empty("devlet hastanesi");

        assertThat(resolver.resolve(entities, directory).candidates()).isEmpty();
    }

    @Test
    void shouldMapConfidenceToTiers() {
        assertThat(resolver.tierFor(0.40)).isEqualTo(MatchTier.HIGH);
        assertThat(resolver.tierFor(0.39)).isEqualTo(MatchTier.MEDIUM);
        assertThat(resolver.tierFor(0.25)).isEqualTo(MatchTier.MEDIUM);
        assertThat(resolver.tierFor(0.15)).isEqualTo(MatchTier.LOW);
        assertThat(resolver.tierFor(0.14)).isEqualTo(MatchTier.NONE);
    }

    @Test
    void shouldMatchPhoneOnLastSevenDigits() {
        assertThat(IdentityResolver.phoneMatches("+90 532 123 45 67", "05321234567")).isTrue();
        assertThat(IdentityResolver.phoneMatches("123", "123")).isFalse();
    }
}
