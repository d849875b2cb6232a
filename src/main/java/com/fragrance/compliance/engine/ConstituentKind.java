package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ReferenceData;

import java.util.EnumSet;

/**
 * Outcome of looking up a constituent key. MAPPED_STANDARD and DECOMPOSABLE may both apply;
 * LEAF only applies when neither does.
 */
public enum ConstituentKind {
    MAPPED_STANDARD,
    DECOMPOSABLE,
    LEAF;

    public static EnumSet<ConstituentKind> classify(String key, ReferenceData referenceData) {
        EnumSet<ConstituentKind> kinds = EnumSet.noneOf(ConstituentKind.class);
        if (referenceData.isMappedStandard(key)) {
            kinds.add(MAPPED_STANDARD);
        }
        if (referenceData.isDecomposable(key)) {
            kinds.add(DECOMPOSABLE);
        }
        if (kinds.isEmpty()) {
            kinds.add(LEAF);
        }
        return kinds;
    }
}
