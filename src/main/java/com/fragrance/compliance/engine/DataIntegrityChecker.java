package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ContributionRecord;

import java.util.Locale;
import java.util.Optional;

/**
 * Flags materials whose documented composition falls short of the integrity threshold.
 * Deliberate dilutions ("10% in DPG", "... dilution", "... (dil)") are not flagged.
 */
public class DataIntegrityChecker {

    public Optional<String> check(String displayName, ContributionRecord record, ComplianceParams params) {
        double documented = record.documentedTotal();
        if (documented >= params.getIntegrityThresholdPercent() || isDilution(displayName, params)) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT, "%s (Composition only totals %.1f%%)", displayName, documented));
    }

    private boolean isDilution(String displayName, ComplianceParams params) {
        if (displayName == null || params.getDilutionMarkers() == null) {
            return false;
        }
        String lower = displayName.toLowerCase(Locale.ROOT);
        return params.getDilutionMarkers().stream()
                .anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
    }
}
