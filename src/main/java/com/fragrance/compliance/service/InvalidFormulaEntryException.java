package com.fragrance.compliance.service;

import lombok.Getter;

@Getter
public class InvalidFormulaEntryException extends RuntimeException {

    private final int entryIndex;
    private final String entryName;
    private final String field;
    private final String value;

    public InvalidFormulaEntryException(int entryIndex, String entryName, String field, String value, String reason) {
        super(String.format("Formula entry #%d '%s': %s '%s' %s", entryIndex + 1, entryName, field, value, reason));
        this.entryIndex = entryIndex;
        this.entryName = entryName;
        this.field = field;
        this.value = value;
    }
}
