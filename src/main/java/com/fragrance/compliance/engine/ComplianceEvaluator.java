package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ComplianceResult;
import com.fragrance.compliance.domain.PhototoxicityResult;
import com.fragrance.compliance.domain.Standard;
import com.fragrance.compliance.domain.StandardResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns aggregated exposures into the verdict: per-standard pass/fail, the phototoxicity
 * sum of ratios, the critical component and the maximum safe dosage.
 * <p>
 * All ratios scale linearly with the finished dosage (composition is fixed), so the dosage
 * at which the highest ratio reaches 1.0 is {@code finishedDosage / maxRatio}.
 */
public class ComplianceEvaluator {

    private static final double RATIO_EPSILON = 1e-9;
    private static final double FULL_DOSAGE = 100.0;

    public ComplianceResult evaluate(Map<String, StandardAggregation> aggregations,
                                     double finishedDosage, ComplianceParams params) {
        List<StandardResult> results = new ArrayList<>(aggregations.size());
        boolean allStandardsPass = true;
        String criticalComponent = null;
        double maxRatio = 0.0;

        for (StandardAggregation aggregation : aggregations.values()) {
            StandardResult result = evaluateStandard(aggregation, params);
            results.add(result);
            if (!result.isPass()) {
                allStandardsPass = false;
            }
            // strict comparison keeps the first standard on ties
            if (result.getRatio() > maxRatio && result.getRatio() > RATIO_EPSILON) {
                maxRatio = result.getRatio();
                criticalComponent = result.getStandardName();
            }
        }

        PhototoxicityResult phototoxicity = evaluatePhototoxicity(aggregations);
        if (phototoxicity.getSumOfRatios() > maxRatio && phototoxicity.getSumOfRatios() > RATIO_EPSILON) {
            maxRatio = phototoxicity.getSumOfRatios();
            criticalComponent = PhototoxicityResult.AGGREGATE_NAME;
        }

        double maxSafeDosage = maxRatio > RATIO_EPSILON ? finishedDosage / maxRatio : FULL_DOSAGE;

        return ComplianceResult.builder()
                .compliant(allStandardsPass && phototoxicity.isPass())
                .results(results)
                .phototoxicity(phototoxicity)
                .criticalComponent(criticalComponent)
                .maxRatio(maxRatio)
                .maxSafeDosage(maxSafeDosage)
                .finishedDosage(finishedDosage)
                .build();
    }

    StandardResult evaluateStandard(StandardAggregation aggregation, ComplianceParams params) {
        Standard standard = aggregation.getStandard();
        double concentration = aggregation.getTotalConcentration();

        StandardResult.StandardResultBuilder builder = StandardResult.builder()
                .standardId(standard.getId())
                .standardName(standard.getName())
                .type(standard.getType())
                .concentration(concentration)
                .sources(new LinkedHashMap<>(aggregation.getSources()));

        if (!standard.hasLimit()) {
            return builder
                    .limit(null)
                    .limitDisplay(StandardResult.SPECIFICATION_ONLY_LABEL)
                    .pass(true)
                    .ratio(0.0)
                    .exceedancePerc(0.0)
                    .build();
        }

        double limit = standard.getLimitCat4();
        double ratio = ratio(concentration, limit);
        return builder
                .limit(limit)
                .limitDisplay(BigDecimal.valueOf(limit).stripTrailingZeros().toPlainString())
                .pass(concentration <= limit + params.getPassTolerance())
                .ratio(ratio)
                .exceedancePerc(Math.max(0.0, (ratio - 1.0) * 100.0))
                .build();
    }

    PhototoxicityResult evaluatePhototoxicity(Map<String, StandardAggregation> aggregations) {
        double sumOfRatios = 0.0;
        for (StandardAggregation aggregation : aggregations.values()) {
            Standard standard = aggregation.getStandard();
            if (standard.isPhototoxicity() && standard.hasLimit() && standard.getLimitCat4() > 0) {
                sumOfRatios += aggregation.getTotalConcentration() / standard.getLimitCat4();
            }
        }
        return PhototoxicityResult.builder()
                .sumOfRatios(sumOfRatios)
                .pass(sumOfRatios <= 1.0)
                .exceedancePerc(Math.max(0.0, (sumOfRatios - 1.0) * 100.0))
                .build();
    }

    private double ratio(double concentration, double limit) {
        if (limit > 0) {
            return concentration / limit;
        }
        return concentration == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
    }
}
