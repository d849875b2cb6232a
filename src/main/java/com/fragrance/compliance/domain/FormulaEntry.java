package com.fragrance.compliance.domain;

import lombok.Value;

/**
 * One line of a formula, given either as a mass/parts amount or as a raw percentage.
 */
public interface FormulaEntry {

    /** Display name used for lines that carry none. */
    String UNKNOWN_NAME = "Unknown";

    String getName();

    String getCas();

    String getSku();

    static ByAmount ofAmount(String name, double amount) {
        return new ByAmount(name, null, null, amount);
    }

    static ByConcentration ofConcentration(String name, double concentration) {
        return new ByConcentration(name, null, null, concentration);
    }

    @Value
    class ByAmount implements FormulaEntry {
        String name;
        String cas;
        String sku;
        double amount; // grams, parts, any consistent mass unit
    }

    @Value
    class ByConcentration implements FormulaEntry {
        String name;
        String cas;
        String sku;
        double concentration; // % of concentrate
    }
}
