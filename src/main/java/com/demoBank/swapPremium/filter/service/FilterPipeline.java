package com.demoBank.swapPremium.filter.service;

import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.demoBank.swapPremium.filter.model.FilterKey;
import com.demoBank.swapPremium.filter.model.LtvBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Applies the enabled filter stages to an enriched record set in one pass.
 */
@Slf4j
@Service
public class FilterPipeline {

    private static final List<Stage> STAGES = List.of(
            new Stage(FilterKey.DATE_RANGE, FilterPredicates::inMonthRange),
            new Stage(FilterKey.LENDER, FilterPredicates::matchesLender),
            new Stage(FilterKey.PREMIUM_RANGE, FilterPredicates::inPremiumRange),
            new Stage(FilterKey.PRODUCT_TYPE, FilterPredicates::matchesProductType),
            new Stage(FilterKey.PURCHASE_TYPE, FilterPredicates::matchesPurchaseType),
            new Stage(FilterKey.LTV_BUCKET, FilterPredicates::inLtvBucket),
            new Stage(FilterKey.TERM, FilterPredicates::matchesTerm));

    /**
     * @return unmodifiable list of the records passing every enabled stage, in input order
     */
    public List<EnrichedLoanRecord> apply(List<EnrichedLoanRecord> records, FilterCriteria criteria, FilterFlags flags) {
        List<Stage> active = new ArrayList<>(STAGES.size());
        for (Stage stage : STAGES) {
            if (flags.isEnabled(stage.key)) {
                active.add(stage);
            }
        }

        List<EnrichedLoanRecord> kept = new ArrayList<>();
        int missingLtv = 0;
        boolean ltvActive = flags.isEnabled(FilterKey.LTV_BUCKET) && criteria.getLtvBucket() != LtvBucket.ALL;
        for (EnrichedLoanRecord record : records) {
            if (passesAll(active, record, criteria)) {
                kept.add(record);
                if (ltvActive && record.getLtv() == null) {
                    missingLtv++;
                }
            }
        }
        if (missingLtv > 0) {
            log.debug("{} records without LTV kept by the {} filter", missingLtv, criteria.getLtvBucket());
        }
        log.debug("Filtered {} of {} records with stages {}", kept.size(), records.size(), flags);
        return Collections.unmodifiableList(kept);
    }

    private static boolean passesAll(List<Stage> stages, EnrichedLoanRecord record, FilterCriteria criteria) {
        for (Stage stage : stages) {
            if (!stage.predicate.test(record, criteria)) {
                return false;
            }
        }
        return true;
    }

    private static final class Stage {
        private final FilterKey key;
        private final BiPredicate<EnrichedLoanRecord, FilterCriteria> predicate;

        private Stage(FilterKey key, BiPredicate<EnrichedLoanRecord, FilterCriteria> predicate) {
            this.key = key;
            this.predicate = predicate;
        }
    }
}
