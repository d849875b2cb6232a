package com.fragrance.compliance.domain;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Documented composition of a material: constituent key -> mass percentage.
 * Percentages are not required to sum to 100.
 */
@Value
public class ContributionRecord {
    String key;
    String name;
    Map<String, Double> constituents;

    public ContributionRecord(String key, String name, Map<String, Double> constituents) {
        this.key = key;
        this.name = name;
        this.constituents = Collections.unmodifiableMap(new LinkedHashMap<>(constituents));
    }

    public double documentedTotal() {
        double total = 0.0;
        for (double perc : constituents.values()) {
            total += perc;
        }
        return total;
    }
}
