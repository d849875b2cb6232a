package com.fragrance.compliance.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceParams {
    // Levels of constituent expansion below the formula entry before a branch is cut
    private int maxResolutionDepth;

    // Documented composition below this total (%) raises an integrity warning
    private double integrityThresholdPercent;

    // Absolute slack when comparing a concentration against its limit
    private double passTolerance;

    // Name tokens marking a material as furocoumarin-free (exempt from phototoxicity)
    private List<String> exemptionTokens;

    // Name markers identifying a deliberate dilution (no integrity warning)
    private List<String> dilutionMarkers;

    /**
     * IFRA 51st amendment, category 4 defaults.
     */
    public static ComplianceParams defaults() {
        return ComplianceParams.builder()
                .maxResolutionDepth(10)
                .integrityThresholdPercent(90.0)
                .passTolerance(1e-9)
                .exemptionTokens(List.of("FCF", "DISTILLED", "TERPENELESS"))
                .dilutionMarkers(List.of("% in", "dilution", "(dil)"))
                .build();
    }
}
