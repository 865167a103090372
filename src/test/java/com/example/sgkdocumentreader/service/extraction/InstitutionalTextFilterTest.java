package com.example.sgkdocumentreader.service.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class InstitutionalTextFilterTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "SOSYAL GÜVENLİK KURUMU",
            "Ankara Devlet Hastanesi",
            "T.C. Sağlık Bakanlığı",
            "Tıbbi Cihaz Raporu",
            "Dr. Ahmet",
            "ABC Ltd",
            "Odyoloğun Raporu",
            "Hastanenin Müdürlüğü"
    })
    void shouldRecognizeInstitutionalText(String text) {
        assertThat(InstitutionalTextFilter.isInstitutional(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Ali Veli", "Ayşe Demir", "Mehmet Kaya", "Stigma Karaca"})
    void shouldAcceptPersonNames(String text) {
        assertThat(InstitutionalTextFilter.isInstitutional(text)).isFalse();
    }

    @Test
    void shouldTreatBlankAsNonInstitutional() {
        assertThat(InstitutionalTextFilter.isInstitutional(" ")).isFalse();
        assertThat(InstitutionalTextFilter.isInstitutional(null)).isFalse();
    }
}
