package com.demoBank.swapPremium.normalization.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class TermNormalizerTest {

    @Nested
    @DisplayName("numeric terms")
    class NumericTerms {

        @Test
        void keepsBenchmarkTerms() {
            assertThat(TermNormalizer.normalizeTerm(24)).isEqualTo(24);
            assertThat(TermNormalizer.normalizeTerm(60)).isEqualTo(60);
        }

        @Test
        void bucketsTermsJustAboveABenchmark() {
            assertThat(TermNormalizer.normalizeTerm(25)).isEqualTo(24);
            assertThat(TermNormalizer.normalizeTerm(27)).isEqualTo(24);
            assertThat(TermNormalizer.normalizeTerm(63)).isEqualTo(60);
        }

        @Test
        void rejectsNonStandardTerms() {
            assertThat(TermNormalizer.normalizeTerm(30)).isNull();
            assertThat(TermNormalizer.normalizeTerm(23)).isNull();
            assertThat(TermNormalizer.normalizeTerm(64)).isNull();
            assertThat(TermNormalizer.normalizeTerm((Integer) null)).isNull();
        }
    }

    @Nested
    @DisplayName("text terms")
    class TextTerms {

        @ParameterizedTest
        @CsvSource({
                "2 years, 24",
                "2yr fixed, 24",
                "5 year tracker, 60",
                "5yr, 60",
                "24, 24",
                "26 months, 24",
                "60.0, 60"
        })
        void readsLeadingDigits(String period, int expected) {
            assertThat(TermNormalizer.normalizeTerm(period)).isEqualTo(expected);
        }

        @Test
        void rejectsMissingOrUnreadableText() {
            assertThat(TermNormalizer.normalizeTerm((String) null)).isNull();
            assertThat(TermNormalizer.normalizeTerm("  ")).isNull();
            assertThat(TermNormalizer.normalizeTerm("lifetime tracker")).isNull();
            assertThat(TermNormalizer.normalizeTerm("3 years")).isNull();
        }

        @Test
        void ignoresOversizedDigitRuns() {
            assertThat(TermNormalizer.toMonths("99999999999 years")).isNull();
        }
    }
}
