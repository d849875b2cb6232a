package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ComplianceResult;
import com.fragrance.compliance.domain.ContributionRecord;
import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.NormalizedEntry;
import com.fragrance.compliance.domain.ReferenceData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Formula -> normalized concentrations -> resolved constituents -> standards -> verdict.
 * <p>
 * Holds no per-call state; one instance serves concurrent calculations.
 */
@Slf4j
@Component
public class DefaultComplianceEngine implements ComplianceEngine {

    private final FormulaNormalizer normalizer = new FormulaNormalizer();
    private final ContributionResolver resolver = new ContributionResolver();
    private final StandardAggregator aggregator = new StandardAggregator();
    private final DataIntegrityChecker integrityChecker = new DataIntegrityChecker();
    private final ComplianceEvaluator evaluator = new ComplianceEvaluator();

    @Override
    public ComplianceResult calculate(List<FormulaEntry> formula, double finishedDosage,
                                      ReferenceData referenceData, ComplianceParams params) {
        long startTime = System.currentTimeMillis();

        List<NormalizedEntry> entries = normalizer.normalize(formula, finishedDosage);

        ExposureLedger ledger = new ExposureLedger();
        List<String> unresolved = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> truncated = new ArrayList<>();

        for (NormalizedEntry entry : entries) {
            String name = entry.getName();
            String key = resolutionKey(entry, referenceData);
            if (key == null) {
                unresolved.add(name);
                continue;
            }

            boolean exempt = PhototoxicityExemption.isExempt(name, params.getExemptionTokens());

            Optional<ContributionRecord> record = referenceData.contribution(key);
            if (record.isPresent()) {
                integrityChecker.check(name, record.get(), params).ifPresent(warnings::add);

                Resolution resolution = resolver.resolve(key, entry.getConcentration(), referenceData,
                        params.getMaxResolutionDepth());
                for (Map.Entry<String, Double> contribution : resolution.getContributions().entrySet()) {
                    ledger.add(contribution.getKey(), contribution.getValue(), name, exempt);
                }
                if (resolution.isTruncated()) {
                    log.warn("Resolution of '{}' truncated at depth {}", name, params.getMaxResolutionDepth());
                    truncated.add(name);
                }
            }

            // the material may itself be regulated, independently of its breakdown
            if (referenceData.isMappedStandard(key)) {
                ledger.add(key, entry.getConcentration(), name, exempt);
            }
        }

        Map<String, StandardAggregation> aggregations = aggregator.aggregate(ledger, referenceData);
        ComplianceResult result = evaluator.evaluate(aggregations, finishedDosage, params);

        Collections.sort(unresolved);
        Collections.sort(warnings);
        Collections.sort(truncated);
        result.setUnresolvedMaterials(unresolved);
        result.setDataIntegrityWarnings(warnings);
        result.setTruncatedMaterials(truncated);

        log.debug("Evaluated {} entries against {} standards in {} ms",
                entries.size(), aggregations.size(), System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * First of CAS, SKU, name that is known to the reference data, or null.
     */
    String resolutionKey(NormalizedEntry entry, ReferenceData referenceData) {
        for (String candidate : new String[]{entry.getCas(), entry.getSku(), entry.getName()}) {
            String key = ReferenceData.normalizeKey(candidate);
            if (key != null && (referenceData.isDecomposable(key) || referenceData.isMappedStandard(key))) {
                return key;
            }
        }
        return null;
    }
}
