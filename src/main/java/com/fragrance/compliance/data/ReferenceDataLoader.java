package com.fragrance.compliance.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragrance.compliance.domain.ContributionRecord;
import com.fragrance.compliance.domain.ReferenceData;
import com.fragrance.compliance.domain.Standard;
import com.fragrance.compliance.domain.StandardType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the standards and contributions tables and builds the immutable {@link ReferenceData}.
 * Structural problems fail the load; regulatory correctness of the values is not checked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceDataLoader {

    private static final TypeReference<Map<String, ContributionDefinition>> CONTRIBUTIONS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ReferenceData load(Resource standards, Resource contributions) {
        try (InputStream standardsIn = standards.getInputStream();
             InputStream contributionsIn = contributions.getInputStream()) {
            ReferenceData data = load(standardsIn, contributionsIn);
            log.info("Loaded reference data: {} standards, {} CAS mappings, {} materials (from {} and {})",
                    data.standardCount(), data.mappingCount(), data.contributionCount(),
                    standards.getDescription(), contributions.getDescription());
            return data;
        } catch (IOException e) {
            throw new ReferenceDataException("Cannot read reference data: " + e.getMessage(), e);
        }
    }

    public ReferenceData load(InputStream standardsIn, InputStream contributionsIn) {
        StandardsDocument standardsDocument = read(standardsIn, StandardsDocument.class, "standards");
        Map<String, ContributionDefinition> contributionDocument = read(contributionsIn, "contributions");

        if (standardsDocument.getMetadata() == null) {
            throw new ReferenceDataException("Standards document has no 'metadata' section");
        }
        if (standardsDocument.getCasMapping() == null) {
            throw new ReferenceDataException("Standards document has no 'cas_mapping' section");
        }

        return new ReferenceData(
                toStandards(standardsDocument.getMetadata()),
                toCasMapping(standardsDocument.getCasMapping()),
                toContributions(contributionDocument));
    }

    private <T> T read(InputStream in, Class<T> type, String what) {
        try {
            T value = objectMapper.readValue(in, type);
            if (value == null) {
                throw new ReferenceDataException("The " + what + " document is empty");
            }
            return value;
        } catch (IOException e) {
            throw new ReferenceDataException("Malformed " + what + " document: " + e.getMessage(), e);
        }
    }

    private Map<String, ContributionDefinition> read(InputStream in, String what) {
        try {
            Map<String, ContributionDefinition> value = objectMapper.readValue(in, CONTRIBUTIONS_TYPE);
            if (value == null) {
                throw new ReferenceDataException("The " + what + " document is empty");
            }
            return value;
        } catch (IOException e) {
            throw new ReferenceDataException("Malformed " + what + " document: " + e.getMessage(), e);
        }
    }

    private Map<String, Standard> toStandards(Map<String, StandardsDocument.StandardDefinition> metadata) {
        Map<String, Standard> standards = new LinkedHashMap<>();
        metadata.forEach((id, definition) -> {
            if (definition == null) {
                throw new ReferenceDataException("Standard " + id + " has no definition");
            }
            Double limit = definition.getLimitCat4();
            if (limit != null && (limit < 0 || limit.isNaN() || limit.isInfinite())) {
                throw new ReferenceDataException("Standard " + id + " has an invalid limit: " + limit);
            }
            standards.put(id, Standard.builder()
                    .id(id)
                    .name(definition.getName() == null ? id : definition.getName())
                    .type(StandardType.fromLabel(definition.getType()))
                    .typeLabel(definition.getType())
                    .limitCat4(limit)
                    .build());
        });
        return standards;
    }

    private Map<String, List<String>> toCasMapping(Map<String, List<String>> raw) {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        raw.forEach((cas, ids) -> {
            String key = ReferenceData.normalizeKey(cas);
            if (key == null) {
                return;
            }
            mapping.computeIfAbsent(key, k -> new ArrayList<>()).addAll(ids == null ? List.of() : ids);
        });
        return mapping;
    }

    private Map<String, ContributionRecord> toContributions(Map<String, ContributionDefinition> raw) {
        Map<String, ContributionRecord> records = new LinkedHashMap<>();
        raw.forEach((rawKey, definition) -> {
            String key = ReferenceData.normalizeKey(rawKey);
            if (key == null || definition == null) {
                return;
            }
            Map<String, Double> constituents = new LinkedHashMap<>();
            if (definition.getConstituents() != null) {
                definition.getConstituents().forEach((rawConstituent, perc) -> {
                    if (perc == null || perc.isNaN() || perc < 0 || perc > 100) {
                        throw new ReferenceDataException(
                                "Material " + rawKey + " has an invalid percentage for " + rawConstituent + ": " + perc);
                    }
                    String constituent = ReferenceData.normalizeKey(rawConstituent);
                    if (constituent != null) {
                        constituents.merge(constituent, perc, Double::sum);
                    }
                });
            }
            String name = definition.getName() == null ? rawKey : definition.getName();
            records.put(key, new ContributionRecord(key, name, constituents));
        });
        return records;
    }
}
