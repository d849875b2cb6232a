package com.fragrance.compliance.service;

import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ContributionRecord;
import com.fragrance.compliance.domain.MaterialBreakdown;
import com.fragrance.compliance.domain.MaterialSummary;
import com.fragrance.compliance.domain.ReferenceData;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ingredient lookup over the contributions table.
 */
@Service
@RequiredArgsConstructor
public class MaterialLookupService {

    public static final int DEFAULT_LIMIT = 25;

    private final ReferenceData referenceData;
    private final ComplianceParams complianceParams;

    public List<MaterialSummary> search(String query, Integer limit) {
        int max = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        return referenceData.searchContributions(query, max).stream()
                .map(r -> new MaterialSummary(r.getKey(), r.getName(), r.getConstituents().size()))
                .collect(Collectors.toList());
    }

    public MaterialBreakdown breakdown(String key) {
        ContributionRecord record = referenceData.contribution(key)
                .orElseThrow(() -> new MaterialNotFoundException(key));

        List<MaterialBreakdown.Constituent> constituents = record.getConstituents().entrySet().stream()
                .map(e -> MaterialBreakdown.Constituent.builder()
                        .key(e.getKey())
                        .percentage(e.getValue())
                        .regulated(referenceData.isMappedStandard(e.getKey()))
                        .standardIds(referenceData.standardIdsFor(e.getKey()))
                        .decomposable(referenceData.isDecomposable(e.getKey()))
                        .build())
                .sorted(Comparator.comparingDouble(MaterialBreakdown.Constituent::getPercentage).reversed()
                        .thenComparing(MaterialBreakdown.Constituent::getKey))
                .collect(Collectors.toList());

        double total = record.documentedTotal();
        return MaterialBreakdown.builder()
                .key(record.getKey())
                .name(record.getName())
                .constituents(constituents)
                .documentedTotal(total)
                .incomplete(total < complianceParams.getIntegrityThresholdPercent())
                .build();
    }
}
