package com.fragrance.compliance.domain;

import java.util.Locale;

public enum StandardType {
    RESTRICTION,
    PHOTOTOXICITY,
    SPECIFICATION_ONLY;

    /**
     * Classifies the free-text type label used in the standards table,
     * e.g. "Restriction", "Phototoxicity (sum of ratios)", "Specification".
     */
    public static StandardType fromLabel(String label) {
        if (label == null) {
            return RESTRICTION;
        }
        String upper = label.toUpperCase(Locale.ROOT);
        if (upper.contains("PHOTOTOX")) {
            return PHOTOTOXICITY;
        }
        if (upper.contains("SPEC")) {
            return SPECIFICATION_ONLY;
        }
        return RESTRICTION;
    }
}
