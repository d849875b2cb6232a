package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ReferenceData;
import com.fragrance.compliance.support.TestReferenceData;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StandardAggregatorTest {
    private final StandardAggregator aggregator = new StandardAggregator();

    private final ReferenceData data = TestReferenceData.builder()
            .phototoxicity("P_BERGAMOT", "Bergamot oil expressed", 0.4)
            .restriction("R_BERGAMOT", "Bergamot oil (sensitization)", 2.0)
            .restriction("R_ROSE", "Rose Ketones", 0.02)
            .map("8007-75-8", "P_BERGAMOT", "R_BERGAMOT")
            .map("24720-09-0", "R_ROSE")
            .map("23726-91-2", "R_ROSE", "MISSING")
            .build();

    @Test
    void exemptComponentSkipsOnlyPhototoxicityStandards() {
        ExposureLedger ledger = new ExposureLedger();
        ledger.add("8007-75-8", 1.5, "Bergamot FCF", true);

        Map<String, StandardAggregation> aggregations = aggregator.aggregate(ledger, data);

        assertThat(aggregations).containsOnlyKeys("R_BERGAMOT");
        assertThat(aggregations.get("R_BERGAMOT").getTotalConcentration()).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void oneNonExemptContributorCancelsTheExemption() {
        ExposureLedger ledger = new ExposureLedger();
        ledger.add("8007-75-8", 1.0, "Bergamot FCF", true);
        ledger.add("8007-75-8", 0.5, "Bergamot oil", false);

        Map<String, StandardAggregation> aggregations = aggregator.aggregate(ledger, data);

        assertThat(aggregations).containsKeys("P_BERGAMOT", "R_BERGAMOT");
        StandardAggregation photo = aggregations.get("P_BERGAMOT");
        assertThat(photo.getTotalConcentration()).isCloseTo(1.5, within(1e-12));
        assertThat(photo.getSources()).containsOnlyKeys("Bergamot FCF", "Bergamot oil");
    }

    @Test
    void groupStandardSumsMembersAndMergesSourcesByName() {
        ExposureLedger ledger = new ExposureLedger();
        ledger.add("24720-09-0", 0.01, "Damascone blend", false);
        ledger.add("23726-91-2", 0.02, "Damascone blend", false);
        ledger.add("23726-91-2", 0.005, "Beta Damascone", false);

        Map<String, StandardAggregation> aggregations = aggregator.aggregate(ledger, data);

        StandardAggregation rose = aggregations.get("R_ROSE");
        assertThat(rose.getTotalConcentration()).isCloseTo(0.035, within(1e-12));
        assertThat(rose.getSources().get("Damascone blend")).isCloseTo(0.03, within(1e-12));
        assertThat(rose.getSources().get("Beta Damascone")).isCloseTo(0.005, within(1e-12));
        assertThat(aggregations).doesNotContainKey("MISSING");
    }

    @Test
    void unmappedConstituentsAreIgnored() {
        ExposureLedger ledger = new ExposureLedger();
        ledger.add("60-12-8", 12.0, "Phenyl Ethyl Alcohol", false);

        assertThat(aggregator.aggregate(ledger, data)).isEmpty();
    }
}
