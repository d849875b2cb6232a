package com.fragrance.compliance.domain;

import lombok.Value;

@Value
public class MaterialSummary {
    String key;
    String name;
    int constituentCount;
}
