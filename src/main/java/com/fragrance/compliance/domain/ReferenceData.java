package com.fragrance.compliance.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable lookup context: standards, CAS-to-standard mapping and material contributions.
 * Passed explicitly into every engine call. All keys are stored normalized.
 */
public final class ReferenceData {

    private final Map<String, Standard> standards;
    private final Map<String, List<String>> casMapping;
    private final Map<String, ContributionRecord> contributions;

    public ReferenceData(Map<String, Standard> standards,
                         Map<String, List<String>> casMapping,
                         Map<String, ContributionRecord> contributions) {
        this.standards = Collections.unmodifiableMap(new LinkedHashMap<>(standards));

        Map<String, List<String>> mapping = new LinkedHashMap<>();
        casMapping.forEach((cas, ids) -> {
            String key = normalizeKey(cas);
            if (key == null || ids == null) {
                return;
            }
            mapping.merge(key, List.copyOf(new LinkedHashSet<>(ids)), (a, b) -> {
                LinkedHashSet<String> merged = new LinkedHashSet<>(a);
                merged.addAll(b);
                return List.copyOf(merged);
            });
        });
        this.casMapping = Collections.unmodifiableMap(mapping);

        Map<String, ContributionRecord> records = new LinkedHashMap<>();
        contributions.forEach((key, record) -> {
            String normalized = normalizeKey(key);
            if (normalized != null) {
                records.put(normalized, record);
            }
        });
        this.contributions = Collections.unmodifiableMap(records);
    }

    public static ReferenceData empty() {
        return new ReferenceData(Map.of(), Map.of(), Map.of());
    }

    /**
     * Lookup keys are compared trimmed and lower-cased. Returns null for blank input.
     */
    public static String normalizeKey(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public Optional<Standard> standard(String id) {
        return Optional.ofNullable(standards.get(id));
    }

    public List<String> standardIdsFor(String cas) {
        return casMapping.getOrDefault(normalizeKey(cas), List.of());
    }

    public boolean isMappedStandard(String key) {
        String normalized = normalizeKey(key);
        return normalized != null && casMapping.containsKey(normalized);
    }

    public Optional<ContributionRecord> contribution(String key) {
        String normalized = normalizeKey(key);
        return normalized == null ? Optional.empty() : Optional.ofNullable(contributions.get(normalized));
    }

    public boolean isDecomposable(String key) {
        String normalized = normalizeKey(key);
        return normalized != null && contributions.containsKey(normalized);
    }

    /**
     * Case-insensitive substring search over material keys and display names, ordered by key.
     */
    public List<ContributionRecord> searchContributions(String query, int limit) {
        String needle = normalizeKey(query);
        if (needle == null || limit <= 0) {
            return List.of();
        }
        List<ContributionRecord> matches = new ArrayList<>();
        for (Map.Entry<String, ContributionRecord> entry : new TreeMap<>(contributions).entrySet()) {
            String name = entry.getValue().getName();
            if (entry.getKey().contains(needle)
                    || (name != null && name.toLowerCase(Locale.ROOT).contains(needle))) {
                matches.add(entry.getValue());
                if (matches.size() >= limit) {
                    break;
                }
            }
        }
        return matches;
    }

    public int standardCount() {
        return standards.size();
    }

    public int mappingCount() {
        return casMapping.size();
    }

    public int contributionCount() {
        return contributions.size();
    }
}
