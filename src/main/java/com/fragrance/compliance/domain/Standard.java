package com.fragrance.compliance.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Standard {
    String id;
    String name;
    StandardType type;

    // Label exactly as found in the standards table
    String typeLabel;

    // Category 4 (fine fragrance) limit, % of finished product. Null = specification only.
    Double limitCat4;

    public boolean hasLimit() {
        return limitCat4 != null;
    }

    public boolean isPhototoxicity() {
        return type == StandardType.PHOTOTOXICITY;
    }
}
