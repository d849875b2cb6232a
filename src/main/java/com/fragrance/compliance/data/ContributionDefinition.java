package com.fragrance.compliance.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * On-disk shape of one material in the contributions table.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContributionDefinition {
    private String name;
    private Map<String, Double> constituents;
}
