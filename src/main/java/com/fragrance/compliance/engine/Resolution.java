package com.fragrance.compliance.engine;

import lombok.Value;

import java.util.Map;

@Value
public class Resolution {
    // Constituent key -> concentration (% of finished product)
    Map<String, Double> contributions;

    // True when at least one branch hit the depth guard and was not expanded
    boolean truncated;
}
