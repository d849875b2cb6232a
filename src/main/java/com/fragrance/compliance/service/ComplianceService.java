package com.fragrance.compliance.service;

import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ComplianceResult;
import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.RawFormulaEntry;
import com.fragrance.compliance.domain.ReferenceData;
import com.fragrance.compliance.engine.ComplianceEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceService {

    public static final double DEFAULT_FINISHED_DOSAGE = 100.0;

    private final ComplianceEngine complianceEngine;
    private final FormulaEntryParser entryParser;
    private final ReferenceData referenceData;
    private final ComplianceParams complianceParams;

    public ComplianceResult checkRequest(List<RawFormulaEntry> formula, Double finishedDosage) {
        if (formula == null || formula.isEmpty()) {
            throw new IllegalArgumentException("Formula cannot be empty");
        }
        return checkCompliance(entryParser.parse(formula), finishedDosage);
    }

    public ComplianceResult checkCompliance(List<FormulaEntry> formula, Double finishedDosage) {
        // Fallback to the pure concentrate
        double dosage = finishedDosage == null ? DEFAULT_FINISHED_DOSAGE : finishedDosage;

        // Basic Validation
        if (formula == null || formula.isEmpty()) {
            throw new IllegalArgumentException("Formula cannot be empty");
        }
        if (Double.isNaN(dosage) || dosage <= 0 || dosage > 100) {
            throw new IllegalArgumentException("Finished dosage must be in (0, 100], got " + dosage);
        }

        ComplianceResult result = complianceEngine.calculate(formula, dosage, referenceData, complianceParams);

        log.info("Compliance check: {} entries at {}% -> {} (critical: {}, max safe dosage {}%)",
                formula.size(), dosage, result.isCompliant() ? "PASS" : "FAIL",
                result.getCriticalComponent(), String.format("%.4f", result.getMaxSafeDosage()));
        if (!result.getUnresolvedMaterials().isEmpty()) {
            log.info("Materials not found in reference data: {}", result.getUnresolvedMaterials());
        }
        return result;
    }
}
