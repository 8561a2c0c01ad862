package com.demoBank.swapPremium.aggregation.service;

import com.demoBank.swapPremium.aggregation.model.AggregationResult;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.demoBank.swapPremium.filter.model.FilterKey;
import com.demoBank.swapPremium.filter.service.FilterPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.demoBank.swapPremium.support.RecordFixtures.enriched;
import static org.assertj.core.api.Assertions.assertThat;

class AggregationServiceTest {

    private final AggregationService service = new AggregationService(new FilterPipeline());

    private final List<EnrichedLoanRecord> records = List.of(
            enriched("HSBC", "240-260", "2024-02", 100_000),
            enriched("HSBC", "0-20", "2024-01", 50_000),
            enriched("Barclays", "240-260", "2024-01", 150_000),
            enriched("NatWest", "0-20", "2024-02", 75_000),
            enriched("NatWest", "-20-0", "2024-03", 25_000),
            enriched("Lloyds", "Unknown", "2024-01", 300_000),
            enriched("Santander", "20-40", "2024-01", 0));

    @Nested
    @DisplayName("aggregate")
    class Aggregate {

        @Test
        void sortsBandsByLowerBoundAndMonthsAscending() {
            AggregationResult result = service.aggregate(records);

            assertThat(result.getPremiumBands()).containsExactly("-20-0", "0-20", "240-260");
            assertThat(result.getMonths()).containsExactly("2024-01", "2024-02", "2024-03");
        }

        @Test
        void sumsEachQualifyingRecordOnce() {
            AggregationResult result = service.aggregate(records);

            assertThat(result.cell("240-260", "2024-01")).isEqualTo(150_000);
            assertThat(result.cell("240-260", "2024-03")).isZero();
            assertThat(result.bandTotal("0-20")).isEqualTo(125_000);
            assertThat(result.monthTotal("2024-01")).isEqualTo(200_000);
            assertThat(result.getGrandTotal()).isEqualTo(400_000);
            assertThat(result.getRecordCount()).isEqualTo(5);
        }

        @Test
        void keepsBandMonthAndGrandTotalsConsistent() {
            AggregationResult result = service.aggregate(records);

            double byBand = result.getTotalsByBand().values().stream().mapToDouble(Double::doubleValue).sum();
            double byMonth = result.getTotalsByMonth().values().stream().mapToDouble(Double::doubleValue).sum();
            double byCell = result.getCells().values().stream()
                    .flatMap(row -> row.values().stream())
                    .mapToDouble(Double::doubleValue)
                    .sum();

            assertThat(byBand).isEqualTo(result.getGrandTotal());
            assertThat(byMonth).isEqualTo(result.getGrandTotal());
            assertThat(byCell).isEqualTo(result.getGrandTotal());
        }

        @Test
        void handlesEmptyInput() {
            AggregationResult result = service.aggregate(List.of());

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.getPremiumBands()).isEmpty();
            assertThat(result.getGrandTotal()).isZero();
        }
    }

    @Nested
    @DisplayName("market baseline")
    class MarketBaseline {

        private final FilterCriteria hsbcInJanuary = FilterCriteria.builder()
                .lender("HSBC")
                .startMonth("2024-01")
                .endMonth("2024-01")
                .build();

        @Test
        void ignoresLenderSelection() {
            AggregationResult baseline = service.aggregateMarketBaseline(records, hsbcInJanuary);

            assertThat(baseline.getGrandTotal()).isEqualTo(200_000);
            assertThat(baseline.bandTotal("240-260")).isEqualTo(150_000);
        }

        @Test
        void forcesLenderFlagOffForExplicitFlags() {
            AggregationResult baseline = service.aggregateMarketBaseline(
                    records, hsbcInJanuary, FilterFlags.allEnabled());

            assertThat(baseline.getGrandTotal()).isEqualTo(200_000);
        }

        @Test
        void followsDisabledDateFlag() {
            AggregationResult baseline = service.aggregateMarketBaseline(
                    records, hsbcInJanuary, FilterFlags.allEnabled().without(FilterKey.DATE_RANGE));

            assertThat(baseline.getGrandTotal()).isEqualTo(400_000);
        }
    }
}
