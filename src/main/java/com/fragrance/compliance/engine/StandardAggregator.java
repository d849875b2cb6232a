package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ReferenceData;
import com.fragrance.compliance.domain.Standard;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Folds constituent exposures into their regulatory standards.
 * <p>
 * A constituent whose every contributor is phototoxicity-exempt is left out of phototoxicity
 * standards only; it still counts toward the other standards it is mapped to.
 */
@Slf4j
public class StandardAggregator {

    public Map<String, StandardAggregation> aggregate(ExposureLedger ledger, ReferenceData referenceData) {
        Map<String, StandardAggregation> aggregations = new TreeMap<>();

        for (Map.Entry<String, ResolvedContribution> entry : ledger.getComponents().entrySet()) {
            String cas = entry.getKey();
            ResolvedContribution component = entry.getValue();

            for (String standardId : referenceData.standardIdsFor(cas)) {
                Optional<Standard> standard = referenceData.standard(standardId);
                if (standard.isEmpty()) {
                    log.debug("CAS {} maps to unknown standard {}, skipped", cas, standardId);
                    continue;
                }
                if (standard.get().isPhototoxicity() && component.isPhototoxicityExempt()) {
                    continue;
                }
                aggregations.computeIfAbsent(standardId, id -> new StandardAggregation(standard.get()))
                        .add(component);
            }
        }
        return aggregations;
    }
}
