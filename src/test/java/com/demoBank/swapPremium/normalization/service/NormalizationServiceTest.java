package com.demoBank.swapPremium.normalization.service;

import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.exception.RecordValidationException;
import com.demoBank.swapPremium.normalization.model.NormalizationResult;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawRateQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static com.demoBank.swapPremium.support.RecordFixtures.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NormalizationServiceTest {

    private final NormalizationService service = new NormalizationService(AnalysisSettings.defaults());

    @Nested
    @DisplayName("single record")
    class SingleRecord {

        @Test
        void prefersBaseLenderOverProvider() {
            RawLoanRecord record = raw("1", " HSBC UK Bank ", "2024-01-10", "4.59", "200000", "24");
            record.setBaseLender("  HSBC ");

            NormalizedLoanRecord normalized = service.normalize(record);

            assertThat(normalized.getLenderName()).isEqualTo("HSBC");
            assertThat(normalized.getProviderName()).isEqualTo("HSBC UK Bank");
        }

        @Test
        void fallsBackToEmptyLenderName() {
            RawLoanRecord record = raw("1", null, "2024-01-10", "4.59", "200000", "24");

            assertThat(service.normalize(record).getLenderName()).isEmpty();
        }

        @Test
        void scalesFractionalLtvToPercent() {
            RawLoanRecord record = raw("1", "Barclays", "2024-01-10", "4.59", "200000", "24");
            record.setLtv("0.85");

            assertThat(service.normalize(record).getLtv()).isCloseTo(85.0, within(1e-9));
        }

        @Test
        void readsAlternativeLtvSpellingAndPercentSign() {
            RawLoanRecord record = raw("1", "Barclays", "2024-01-10", "4.59", "200000", "24");
            record.setLoanToValue("75%");

            assertThat(service.normalize(record).getLtv()).isEqualTo(75.0);
        }

        @Test
        void leavesUnparseableLtvAbsent() {
            RawLoanRecord record = raw("1", "Barclays", "2024-01-10", "4.59", "200000", "24");
            record.setLtv("n/a");

            assertThat(service.normalize(record).hasLtv()).isFalse();
        }

        @Test
        void defaultsMissingValues() {
            RawLoanRecord record = raw("1", "Barclays", null, null, null, "2 years");

            NormalizedLoanRecord normalized = service.normalize(record);

            assertThat(normalized.getDocumentDate()).isEqualTo(LocalDate.of(1970, 1, 1));
            assertThat(normalized.getRawRate()).isZero();
            assertThat(normalized.getLoanAmount()).isZero();
            assertThat(normalized.getNormalizedTerm()).isEqualTo(24);
        }

        @Test
        void usesTimestampAndUkDateFormats() {
            RawLoanRecord withTimestamp = raw("1", "Barclays", null, "4.5", "1", "24");
            withTimestamp.setTimestamp("2024-02-03T10:15:30");
            RawLoanRecord ukDate = raw("2", "Barclays", "05/03/2024", "4.5", "1", "24");

            assertThat(service.normalize(withTimestamp).getDocumentDate()).isEqualTo(LocalDate.of(2024, 2, 3));
            assertThat(service.normalize(ukDate).getDocumentDate()).isEqualTo(LocalDate.of(2024, 3, 5));
            assertThat(service.normalize(ukDate).getMonth()).isEqualTo("2024-03");
        }

        @Test
        void parsesRateWithPercentSignAndFallsBackToMortgageType() {
            RawLoanRecord record = raw("1", "Barclays", "2024-01-10", null, "200000", "24");
            record.setRate("4.79%");
            record.setProductType(null);
            record.setMortgageType("Tracker");

            NormalizedLoanRecord normalized = service.normalize(record);

            assertThat(normalized.getRawRate()).isEqualTo(4.79);
            assertThat(normalized.getProductType()).isEqualTo("Tracker");
        }

        @Test
        void derivesPurchaseTypeFromFlags() {
            RawLoanRecord record = raw("1", "Barclays", "2024-01-10", "4.5", "200000", "24");
            record.setPurchaseType(null);
            record.setFirstTimeBuyer("Yes");

            assertThat(service.normalize(record).getPurchaseType()).isEqualTo("First Time Buyer");
        }

        @Test
        void rejectsNegativeLoan() {
            RawLoanRecord record = raw("1", "Barclays", "2024-01-10", "4.5", "-100", "24");

            assertThatThrownBy(() -> service.normalize(record))
                    .isInstanceOf(RecordValidationException.class)
                    .hasMessageContaining("Negative loan amount");
        }
    }

    @Nested
    @DisplayName("batch")
    class Batch {

        @Test
        void dropsDuplicatesRightToBuyAndInvalidRecords() {
            RawLoanRecord rightToBuy = raw("3", "HSBC", "2024-01-12", "4.1", "90000", "24");
            rightToBuy.setProductType("Right to Buy Fixed");
            List<RawLoanRecord> input = Arrays.asList(
                    raw("1", "HSBC", "2024-01-10", "4.5", "100000", "24"),
                    raw("1", "HSBC", "2024-01-10", "4.5", "100000", "24"),
                    raw("2", "Barclays", "2024-01-11", "4.6", "-5", "24"),
                    rightToBuy,
                    null,
                    raw(null, "NatWest", "2024-01-12", "4.7", "150000", "60"),
                    raw(null, "NatWest", "2024-01-12", "4.7", "150000", "60"));

            NormalizationResult result = service.normalizeAll(input);

            assertThat(result.getInputCount()).isEqualTo(7);
            assertThat(result.getRecords()).extracting(NormalizedLoanRecord::getLenderName)
                    .containsExactly("HSBC", "NatWest");
            assertThat(result.getDuplicatesDropped()).isEqualTo(2);
            assertThat(result.getRightToBuyExcluded()).isEqualTo(1);
            assertThat(result.getInvalidDropped()).isEqualTo(2);
        }

        @Test
        void keepsRightToBuyWhenExclusionIsDisabled() {
            NormalizationService keeping = new NormalizationService(
                    AnalysisSettings.defaults().toBuilder().excludeRightToBuy(false).build());
            RawLoanRecord rightToBuy = raw("3", "HSBC", "2024-01-12", "4.1", "90000", "24");
            rightToBuy.setProductType("Right to Buy Fixed");
            rightToBuy.setPurchaseType(null);

            NormalizationResult result = keeping.normalizeAll(List.of(rightToBuy));

            assertThat(result.getRecords()).singleElement()
                    .extracting(NormalizedLoanRecord::getPurchaseType)
                    .isEqualTo("Right to buy");
        }

        @Test
        void summarizesLtvCoverage() {
            RawLoanRecord low = raw("1", "HSBC", "2024-01-10", "4.5", "100000", "24");
            low.setLtv("60");
            RawLoanRecord high = raw("2", "HSBC", "2024-01-10", "4.5", "100000", "24");
            high.setLtv("90");
            RawLoanRecord missing = raw("3", "HSBC", "2024-01-10", "4.5", "100000", "24");

            NormalizationResult result = service.normalizeAll(List.of(low, high, missing));

            assertThat(result.getLtvSummary().getRecordsWithLtv()).isEqualTo(2);
            assertThat(result.getLtvSummary().getRecordsMissingLtv()).isEqualTo(1);
            assertThat(result.getLtvSummary().getAverageLtv()).isEqualTo(75.0);
            assertThat(result.getLtvSummary().below80Percent()).isEqualTo(50.0);
        }
    }

    @Test
    void normalizesQuotesAndDropsInvalidOnes() {
        List<RawRateQuote> raw = List.of(
                new RawRateQuote("24", "2024-01-01", "0.0430"),
                new RawRateQuote("60", "bad date", "0.037"),
                new RawRateQuote(null, "2024-01-01", "0.037"),
                new RawRateQuote("60", "2024-01-08", ""));

        List<RateQuote> quotes = service.normalizeQuotes(raw);

        assertThat(quotes).containsExactly(RateQuote.of(24, LocalDate.of(2024, 1, 1), 0.0430));
    }
}
