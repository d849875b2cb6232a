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
public class MaterialBreakdown {
    private String key;
    private String name;

    // Ordered by percentage, highest first
    private List<Constituent> constituents;
    private double documentedTotal;
    private boolean incomplete;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Constituent {
        private String key;
        private double percentage;
        private boolean regulated;
        private List<String> standardIds;
        private boolean decomposable;
    }
}
