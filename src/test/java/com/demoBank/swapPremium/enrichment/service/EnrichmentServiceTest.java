package com.demoBank.swapPremium.enrichment.service;

import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.enrichment.exception.EmptyInputException;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.enrichment.model.EnrichmentResult;
import com.demoBank.swapPremium.enrichment.model.EnrichmentStatistics;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.matching.service.SwapMatcher;
import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.normalization.service.NormalizationService;
import com.demoBank.swapPremium.premium.service.PremiumCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.demoBank.swapPremium.support.RecordFixtures.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class EnrichmentServiceTest {

    private final AnalysisSettings settings = AnalysisSettings.defaults();
    private final EnrichmentService service = new EnrichmentService(
            new NormalizationService(settings), new SwapMatcher(settings), new PremiumCalculator(settings));

    private final List<RateQuote> quotes = List.of(
            RateQuote.of(24, LocalDate.of(2024, 1, 1), 0.0430),
            RateQuote.of(24, LocalDate.of(2024, 2, 1), 0.0420),
            RateQuote.of(60, LocalDate.of(2024, 1, 1), 0.0370));

    @Nested
    @DisplayName("empty input")
    class EmptyInput {

        @Test
        void rejectsEmptyRecords() {
            assertThatThrownBy(() -> service.enrich(List.of(), quotes))
                    .isInstanceOf(EmptyInputException.class);
        }

        @Test
        void rejectsEmptyQuotes() {
            List<RawLoanRecord> records = List.of(raw("1", "HSBC", "2024-01-10", "4.5", "1000", "24"));

            assertThatThrownBy(() -> service.enrich(records, List.of()))
                    .isInstanceOf(EmptyInputException.class)
                    .hasMessageContaining("swap");
        }

        @Test
        void returnsEmptySetWhenNothingSurvivesNormalization() {
            EnrichmentResult result = service.enrich(
                    List.of(raw("1", "HSBC", "2024-01-10", "4.5", "-1", "24")), quotes);

            assertThat(result.getRecords()).isEmpty();
            assertThat(result.getStatistics().getInvalidDropped()).isEqualTo(1);
        }
    }

    @Test
    void pricesMatchedRecordsAndKeepsTheRest() {
        List<RawLoanRecord> records = List.of(
                raw("1", "HSBC", "2024-01-10", "4.59", "200000", "24"),
                raw("2", "Barclays", "2024-02-05", "4.50", "150000", "2 years"),
                raw("3", "NatWest", "2024-01-15", "4.00", "100000", "60"),
                raw("4", "Santander", "2024-01-20", "4.80", "50000", "36"),
                raw("5", "Lloyds", null, "4.80", "75000", "24"));

        EnrichmentResult result = service.enrich(records, quotes);

        assertThat(result.getRecords()).hasSize(5);
        assertThat(result.getRecords()).extracting(EnrichedLoanRecord::getPremiumBps)
                .containsExactly(29, 30, 30, null, null);
        assertThat(result.getRecords()).extracting(EnrichedLoanRecord::getPremiumBand)
                .containsExactly("20-40", "20-40", "20-40", "Unknown", "Unknown");
        assertThat(result.getRecords().get(1).getMatchedQuote().getRate()).isEqualTo(0.0420);
        assertThat(result.getRecords()).extracting(EnrichedLoanRecord::isMatched)
                .containsExactly(true, true, true, false, false);

        EnrichmentStatistics statistics = result.getStatistics();
        assertThat(statistics.getTotalRecords()).isEqualTo(5);
        assertThat(statistics.getIncludedRecords()).isEqualTo(5);
        assertThat(statistics.getMatchedRecords()).isEqualTo(3);
        assertThat(statistics.getNonStandardTermRecords()).isEqualTo(1);
        assertThat(statistics.getNonStandardTermLoanAmount()).isEqualTo(50_000);
        assertThat(statistics.getUnmatchedRecords()).isEqualTo(1);
        assertThat(statistics.getUnmatchedLoanAmount()).isEqualTo(75_000);
        assertThat(statistics.getMissesByMonth()).containsEntry("1970-01", 1);
        assertThat(statistics.getTwoYearRecords()).isEqualTo(3);
        assertThat(statistics.getFiveYearRecords()).isEqualTo(1);
        assertThat(statistics.matchRate()).isEqualTo(60.0);
    }

    @Test
    void countsAnomalousRates() {
        EnrichmentResult result = service.enrich(
                List.of(raw("1", "HSBC", "2024-01-10", "25", "200000", "24")), quotes);

        assertThat(result.getStatistics().getAnomalousRates()).isEqualTo(1);
        assertThat(result.getRecords().get(0).getPremiumBps()).isNotNull();
    }

    @Test
    void enrichesAThousandRecordsWellUnderASecond() {
        List<RawLoanRecord> records = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            String date = LocalDate.of(2024, 1, 1).plusDays(i % 60).toString();
            records.add(raw(String.valueOf(i), "Lender " + (i % 12), date,
                    String.valueOf(4 + (i % 100) / 100.0), String.valueOf(100_000 + i), i % 2 == 0 ? "24" : "60"));
        }

        EnrichmentResult result = assertTimeout(Duration.ofSeconds(1), () -> {
            return service.enrich(records, quotes);
        });

        assertThat(result.getRecords()).hasSize(1_000);
        assertThat(result.getStatistics().getMatchedRecords()).isEqualTo(1_000);
    }
}
