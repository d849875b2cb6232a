package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ComplianceResult;
import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.ReferenceData;

import java.util.List;

public interface ComplianceEngine {
    ComplianceResult calculate(List<FormulaEntry> formula, double finishedDosage,
                               ReferenceData referenceData, ComplianceParams params);
}
