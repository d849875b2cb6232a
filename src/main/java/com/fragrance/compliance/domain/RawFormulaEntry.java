package com.fragrance.compliance.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw formula line as received. Numeric fields are kept as text so malformed values can be
 * reported against the line they belong to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFormulaEntry {
    private String name;
    private String cas;
    private String sku;
    private String amount;        // mass or parts
    private String concentration; // % of concentrate
}
