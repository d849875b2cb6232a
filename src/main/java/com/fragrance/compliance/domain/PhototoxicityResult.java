package com.fragrance.compliance.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhototoxicityResult {
    public static final String AGGREGATE_NAME = "Phototoxicity (Sum of Ratios)";

    private double sumOfRatios;
    private boolean pass;
    private double exceedancePerc;
}
