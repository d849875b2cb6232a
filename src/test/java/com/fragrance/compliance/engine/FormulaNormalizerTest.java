package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.NormalizedEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FormulaNormalizerTest {
    private final FormulaNormalizer normalizer = new FormulaNormalizer();

    @Test
    void equalAmountsAtTwentyPercentGiveTenEach() {
        List<NormalizedEntry> entries = normalizer.normalize(List.of(
                FormulaEntry.ofAmount("A", 50),
                FormulaEntry.ofAmount("B", 50)), 20.0);

        assertThat(entries).extracting(NormalizedEntry::getConcentration)
                .containsExactly(10.0, 10.0);
    }

    @Test
    void concentrationEntriesIgnoreTotalAmount() {
        List<NormalizedEntry> entries = normalizer.normalize(List.of(
                FormulaEntry.ofAmount("A", 3),
                FormulaEntry.ofConcentration("B", 10.0)), 50.0);

        assertThat(entries.get(0).getConcentration()).isCloseTo(50.0, within(1e-12));
        assertThat(entries.get(1).getConcentration()).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void zeroTotalAmountYieldsZeroConcentration() {
        List<NormalizedEntry> entries = normalizer.normalize(List.of(
                FormulaEntry.ofAmount("A", 0),
                FormulaEntry.ofAmount("B", 0)), 100.0);

        assertThat(entries).extracting(NormalizedEntry::getConcentration)
                .containsExactly(0.0, 0.0);
    }

    @Test
    void keepsIdentifiersAndDefaultsMissingName() {
        List<NormalizedEntry> entries = normalizer.normalize(List.of(
                new FormulaEntry.ByAmount(null, "78-70-6", "SKU-1", 1.0)), 100.0);

        NormalizedEntry entry = entries.get(0);
        assertThat(entry.getName()).isEqualTo("Unknown");
        assertThat(entry.getCas()).isEqualTo("78-70-6");
        assertThat(entry.getSku()).isEqualTo("SKU-1");
        assertThat(entry.getConcentration()).isEqualTo(100.0);
    }
}
