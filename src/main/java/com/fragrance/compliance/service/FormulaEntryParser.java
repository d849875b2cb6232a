package com.fragrance.compliance.service;

import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.RawFormulaEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw request lines into typed formula entries. An amount takes precedence over a
 * concentration; a line with neither counts as 0%.
 */
@Slf4j
@Component
public class FormulaEntryParser {

    public List<FormulaEntry> parse(List<RawFormulaEntry> rawEntries) {
        List<FormulaEntry> entries = new ArrayList<>(rawEntries.size());
        for (int i = 0; i < rawEntries.size(); i++) {
            entries.add(parse(i, rawEntries.get(i)));
        }
        return entries;
    }

    FormulaEntry parse(int index, RawFormulaEntry raw) {
        if (raw == null) {
            throw new InvalidFormulaEntryException(index, FormulaEntry.UNKNOWN_NAME, "entry", "null", "is missing");
        }
        String name = isBlank(raw.getName()) ? FormulaEntry.UNKNOWN_NAME : raw.getName().trim();

        if (!isBlank(raw.getAmount())) {
            double amount = parseNumber(index, name, "amount", raw.getAmount());
            return new FormulaEntry.ByAmount(name, raw.getCas(), raw.getSku(), amount);
        }
        if (!isBlank(raw.getConcentration())) {
            double concentration = parseNumber(index, name, "concentration", raw.getConcentration());
            return new FormulaEntry.ByConcentration(name, raw.getCas(), raw.getSku(), concentration);
        }
        log.debug("Formula entry '{}' has neither amount nor concentration, counted as 0%", name);
        return new FormulaEntry.ByConcentration(name, raw.getCas(), raw.getSku(), 0.0);
    }

    private double parseNumber(int index, String name, String field, String raw) {
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFormulaEntryException(index, name, field, raw, "is not a number");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidFormulaEntryException(index, name, field, raw, "is not a finite number");
        }
        if (value < 0) {
            throw new InvalidFormulaEntryException(index, name, field, raw, "must not be negative");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
