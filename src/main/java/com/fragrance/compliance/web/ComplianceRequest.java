package com.fragrance.compliance.web;

import com.fragrance.compliance.domain.RawFormulaEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceRequest {
    private List<RawFormulaEntry> formula;
    private Double finishedDosage; // % of concentrate in the finished product, defaults to 100
}
