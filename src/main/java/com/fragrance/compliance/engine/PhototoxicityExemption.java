package com.fragrance.compliance.engine;

import java.util.List;
import java.util.Locale;

/**
 * Name heuristic for furocoumarin-free citrus materials ("Bergamot FCF", "Lime distilled", ...).
 * Such materials do not count toward phototoxicity standards.
 */
public final class PhototoxicityExemption {

    private PhototoxicityExemption() {
    }

    public static boolean isExempt(String displayName, List<String> tokens) {
        if (displayName == null || tokens == null) {
            return false;
        }
        String upper = displayName.toUpperCase(Locale.ROOT);
        for (String token : tokens) {
            if (token != null && !token.isEmpty() && upper.contains(token.toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
