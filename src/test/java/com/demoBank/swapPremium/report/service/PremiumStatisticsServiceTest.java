package com.demoBank.swapPremium.report.service;

import com.demoBank.swapPremium.report.model.PremiumStatistics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.demoBank.swapPremium.support.RecordFixtures.enriched;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PremiumStatisticsServiceTest {

    private final PremiumStatisticsService service = new PremiumStatisticsService();

    @Test
    void summarizesKnownPremiums() {
        PremiumStatistics statistics = service.premiumStatistics(List.of(
                enriched("HSBC", "0-20", "2024-01", 1),
                enriched("HSBC", "20-40", "2024-01", 1),
                enriched("HSBC", "40-60", "2024-01", 1),
                enriched("HSBC", "100-120", "2024-01", 1),
                enriched("HSBC", "Unknown", "2024-01", 1)));

        assertThat(statistics.getCount()).isEqualTo(4);
        assertThat(statistics.getMin()).isZero();
        assertThat(statistics.getMax()).isEqualTo(100);
        assertThat(statistics.getMean()).isEqualTo(40.0);
        assertThat(statistics.getMedian()).isEqualTo(30.0);
        assertThat(statistics.getStandardDeviation()).isCloseTo(Math.sqrt(1400), within(1e-9));
    }

    @Test
    void isEmptyWithoutPremiums() {
        PremiumStatistics statistics = service.premiumStatistics(List.of(enriched("HSBC", "Unknown", "2024-01", 1)));

        assertThat(statistics.getCount()).isZero();
        assertThat(statistics.getMean()).isNull();
        assertThat(statistics.getMedian()).isNull();
    }
}
