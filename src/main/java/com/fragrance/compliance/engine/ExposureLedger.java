package com.fragrance.compliance.engine;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-calculation map of constituent key -> accumulated exposure. Never shared between calls.
 */
public final class ExposureLedger {

    private final Map<String, ResolvedContribution> components = new TreeMap<>();

    public void add(String constituentKey, double concentration, String sourceName, boolean exempt) {
        components.computeIfAbsent(constituentKey, k -> new ResolvedContribution())
                .add(sourceName, concentration, exempt);
    }

    public Map<String, ResolvedContribution> getComponents() {
        return Collections.unmodifiableMap(components);
    }
}
