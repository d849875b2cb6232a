package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.ContributionRecord;
import com.fragrance.compliance.domain.ReferenceData;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Expands a material into the constituents it contributes to the finished product.
 * <p>
 * Traversal runs on an explicit work stack. Each frame carries the absolute concentration
 * of its material and its depth below the formula entry; frames deeper than {@code maxDepth}
 * are dropped and the resolution is marked truncated. This bounds the work for cyclic
 * or malformed constituent graphs.
 * <p>
 * A constituent that is both a mapped standard and further decomposable is counted on both
 * paths: once as itself and once through its own constituents.
 */
public class ContributionResolver {

    public Resolution resolve(String materialKey, double concentration, ReferenceData referenceData, int maxDepth) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        boolean truncated = false;

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(ReferenceData.normalizeKey(materialKey), concentration, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.depth > maxDepth) {
                truncated = true;
                continue;
            }
            Optional<ContributionRecord> record = referenceData.contribution(frame.key);
            if (record.isEmpty()) {
                continue;
            }
            for (Map.Entry<String, Double> constituent : record.get().getConstituents().entrySet()) {
                String key = constituent.getKey();
                double absolute = frame.concentration * (constituent.getValue() / 100.0);

                EnumSet<ConstituentKind> kinds = ConstituentKind.classify(key, referenceData);
                if (kinds.contains(ConstituentKind.MAPPED_STANDARD) || kinds.contains(ConstituentKind.LEAF)) {
                    contributions.merge(key, absolute, Double::sum);
                }
                if (kinds.contains(ConstituentKind.DECOMPOSABLE)) {
                    stack.push(new Frame(key, absolute, frame.depth + 1));
                }
            }
        }
        return new Resolution(Collections.unmodifiableMap(contributions), truncated);
    }

    private static final class Frame {
        private final String key;
        private final double concentration;
        private final int depth;

        private Frame(String key, double concentration, int depth) {
            this.key = key;
            this.concentration = concentration;
            this.depth = depth;
        }
    }
}
