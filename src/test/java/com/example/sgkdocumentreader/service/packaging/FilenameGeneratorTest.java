package com.example.sgkdocumentreader.service.packaging;

import com.example.sgkdocumentreader.model.DocumentType;
import com.example.sgkdocumentreader.model.MatchTier;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class FilenameGeneratorTest {

    private final FilenameGenerator generator = new FilenameGenerator(
            Clock.fixed(Instant.parse("2024-03-05T14:07:00Z"), ZoneOffset.UTC), 0.8);

    @Test
    void shouldBuildNameFromPatientTypeAndTimestamp() {
        assertThat(generator.generate("Ayşe Demir", DocumentType.PRESCRIPTION, 0.8, MatchTier.HIGH, true))
                .isEqualTo("AYSE_DEMIR_Recete_20240305_1407.pdf");
    }

    @Test
    void shouldFlagUncertainClassification() {
        assertThat(generator.generate("Ali Veli", DocumentType.AUDIOMETRY_REPORT, 0.5, MatchTier.HIGH, true))
                .isEqualTo("ALI_VELI_Odyometri_CHECK_20240305_1407.pdf");
    }

    @Test
    void shouldAppendTierIndicator() {
        assertThat(generator.generate("Ali Veli", DocumentType.PRESCRIPTION, 0.9, MatchTier.MEDIUM, true))
                .endsWith("_1407_VERIFY.pdf");
        assertThat(generator.generate("Ali Veli", DocumentType.PRESCRIPTION, 0.9, MatchTier.LOW, true))
                .endsWith("_1407_MANUAL.pdf");
        assertThat(generator.generate("Ali Veli", DocumentType.PRESCRIPTION, 0.9, MatchTier.NONE, true))
                .endsWith("_1407_UNMATCHED.pdf");
    }

    @Test
    void shouldUseUnknownPatientWhenNoNameIsAvailable() {
        assertThat(generator.generate(null, DocumentType.OTHER, 0.1, MatchTier.NONE, false))
                .isEqualTo("BILINMEYEN_HASTA_Belge_CHECK_20240305_1407.pdf");
    }

    @Test
    void shouldStripUnsafeCharacters() {
        assertThat(FilenameGenerator.sanitize("  Çağrı / Öztürk-Işık ")).isEqualTo("CAGRI_OZTURKISIK");
        assertThat(FilenameGenerator.sanitize("../")).isEmpty();
    }
}
