package com.fragrance.compliance.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceResult {
    private boolean compliant;

    // One entry per aggregated standard, ordered by standard id
    private List<StandardResult> results;
    private PhototoxicityResult phototoxicity;

    // Name of the standard (or the phototoxicity aggregate) with the highest ratio, null if nothing registers
    private String criticalComponent;
    private double maxRatio;

    // Concentrate dosage (%) at which the highest ratio equals 1.0
    private double maxSafeDosage;
    private double finishedDosage;

    private List<String> unresolvedMaterials;
    private List<String> dataIntegrityWarnings;

    // Entries whose constituent graph was cut at the depth guard
    private List<String> truncatedMaterials;
}
