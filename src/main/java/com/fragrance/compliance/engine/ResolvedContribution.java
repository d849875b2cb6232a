package com.fragrance.compliance.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exposure to a single constituent, accumulated over every formula entry that contributes to it.
 */
public final class ResolvedContribution {

    private final Map<String, List<Double>> contributions = new TreeMap<>();
    private boolean phototoxicityExempt = true;

    void add(String sourceName, double concentration, boolean exempt) {
        contributions.computeIfAbsent(sourceName, k -> new ArrayList<>()).add(concentration);
        // exempt only while every contributor is exempt
        phototoxicityExempt = phototoxicityExempt && exempt;
    }

    public double getTotalConcentration() {
        double total = 0.0;
        for (double concentration : getSources().values()) {
            total += concentration;
        }
        return total;
    }

    public boolean isPhototoxicityExempt() {
        return phototoxicityExempt;
    }

    /**
     * Concentration per source name. Repeated contributions of one source are summed smallest first,
     * so the figure does not depend on the order the formula lists them in.
     */
    public Map<String, Double> getSources() {
        Map<String, Double> sources = new TreeMap<>();
        contributions.forEach((name, values) -> sources.put(name, sortedSum(values)));
        return Collections.unmodifiableMap(sources);
    }

    private static double sortedSum(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double total = 0.0;
        for (double value : sorted) {
            total += value;
        }
        return total;
    }
}
