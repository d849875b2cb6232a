package com.fragrance.compliance.domain;

import lombok.Value;

@Value
public class NormalizedEntry {
    String name;
    String cas;
    String sku;

    // % of finished product
    double concentration;
}
