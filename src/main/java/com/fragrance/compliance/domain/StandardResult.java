package com.fragrance.compliance.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StandardResult {
    public static final String SPECIFICATION_ONLY_LABEL = "specification only";

    private String standardId;
    private String standardName;
    private StandardType type;

    private double concentration; // % of finished product
    private Double limit;         // null when specification only
    private String limitDisplay;  // the limit as text, or "specification only"

    private boolean pass;
    private double ratio;
    private double exceedancePerc;

    // Material display name -> contributed concentration
    private Map<String, Double> sources;
}
