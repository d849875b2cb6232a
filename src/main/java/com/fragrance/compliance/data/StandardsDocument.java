package com.fragrance.compliance.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the standards table.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StandardsDocument {

    private Map<String, StandardDefinition> metadata;

    @JsonProperty("cas_mapping")
    private Map<String, List<String>> casMapping;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StandardDefinition {
        private String name;
        private String type;

        @JsonProperty("limit_cat4")
        private Double limitCat4;
    }
}
