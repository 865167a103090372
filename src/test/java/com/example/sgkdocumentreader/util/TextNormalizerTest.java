package com.example.sgkdocumentreader.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void shouldFoldTurkishLettersPreservingCase() {
        assertThat(TextNormalizer.foldTurkish("ÇAĞRI Işık Şükrü Öz")).isEqualTo("CAGRI Isik Sukru Oz");
    }

    @Test
    void shouldNormalizeCaseDiacriticsAndPunctuation() {
        assertThat(TextNormalizer.normalize("  AYŞE-DEMİR,  Yılmaz ")).isEqualTo("ayse demir yilmaz");
    }

    @Test
    void shouldReplaceDigitConfusionsOnlyInsideWords() {
        assertThat(TextNormalizer.normalize("MEHMET K0CA 1955")).isEqualTo("mehmet koca 1955");
        assertThat(TextNormalizer.normalize("AY5E")).isEqualTo("ayse");
    }

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertThat(TextNormalizer.normalize("   ")).isEmpty();
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.tokens("")).isEmpty();
    }

    @Test
    void shouldApplyTurkishProperCase() {
        assertThat(TextNormalizer.toProperCase("İSMAİL IŞIK")).isEqualTo("İsmail Işık");
        assertThat(TextNormalizer.toProperCase("ali veli")).isEqualTo("Ali Veli");
    }
}
