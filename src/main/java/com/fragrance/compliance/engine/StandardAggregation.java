package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.Standard;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

@Getter
public final class StandardAggregation {

    private final Standard standard;
    private double totalConcentration;
    private final Map<String, Double> sources = new TreeMap<>();

    StandardAggregation(Standard standard) {
        this.standard = standard;
    }

    void add(ResolvedContribution component) {
        totalConcentration += component.getTotalConcentration();
        component.getSources().forEach((name, conc) -> sources.merge(name, conc, Double::sum));
    }

    public Map<String, Double> getSources() {
        return Collections.unmodifiableMap(sources);
    }
}
