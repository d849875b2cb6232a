package com.fragrance.compliance.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragrance.compliance.domain.ReferenceData;
import com.fragrance.compliance.domain.Standard;
import com.fragrance.compliance.domain.StandardType;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceDataLoaderTest {
    private static final String VALID_CONTRIBUTIONS = "{\"m\": {\"name\": \"M\", \"constituents\": {\"78-70-6\": 50}}}";

    private final ReferenceDataLoader loader = new ReferenceDataLoader(new ObjectMapper());

    @Test
    void loadsAndNormalizesFixtureTables() {
        ReferenceData data = loader.load(
                new ClassPathResource("fixtures/standards.json"),
                new ClassPathResource("fixtures/contributions.json"));

        assertThat(data.standardCount()).isEqualTo(3);
        assertThat(data.contributionCount()).isEqualTo(3);

        Standard linalool = data.standard("IFRA_LINALOOL").orElseThrow();
        assertThat(linalool.getType()).isEqualTo(StandardType.SPECIFICATION_ONLY);
        assertThat(linalool.hasLimit()).isFalse();

        Standard bergamot = data.standard("IFRA_BERGAMOT_OIL").orElseThrow();
        assertThat(bergamot.getType()).isEqualTo(StandardType.PHOTOTOXICITY);
        assertThat(bergamot.getTypeLabel()).isEqualTo("PHOTOTOXICITY (sum of ratios)");
        assertThat(bergamot.getLimitCat4()).isEqualTo(0.4);

        assertThat(data.isMappedStandard("5392-40-5")).isTrue();
        assertThat(data.standardIdsFor("8007-75-8")).containsExactly("IFRA_BERGAMOT_OIL", "IFRA_UNKNOWN");

        assertThat(data.contribution("  bergamot fcf oil ")).isPresent();
        assertThat(data.contribution("BERGAMOT FCF OIL").orElseThrow().getName()).isEqualTo("Bergamot FCF Oil");
        assertThat(data.contribution("unnamed-material").orElseThrow().getName()).isEqualTo("unnamed-material");
    }

    @Test
    void rejectsNegativeLimit() {
        String standards = "{\"metadata\": {\"S\": {\"name\": \"S\", \"type\": \"Restriction\", \"limit_cat4\": -1}},"
                + " \"cas_mapping\": {}}";

        assertThatThrownBy(() -> loader.load(stream(standards), stream(VALID_CONTRIBUTIONS)))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageContaining("invalid limit");
    }

    @Test
    void rejectsPercentageAboveHundred() {
        String standards = "{\"metadata\": {}, \"cas_mapping\": {}}";
        String contributions = "{\"m\": {\"name\": \"M\", \"constituents\": {\"78-70-6\": 120}}}";

        assertThatThrownBy(() -> loader.load(stream(standards), stream(contributions)))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageContaining("invalid percentage");
    }

    @Test
    void rejectsMissingMappingSection() {
        String standards = "{\"metadata\": {}}";

        assertThatThrownBy(() -> loader.load(stream(standards), stream(VALID_CONTRIBUTIONS)))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageContaining("cas_mapping");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> loader.load(stream("{not json"), stream(VALID_CONTRIBUTIONS)))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageStartingWith("Malformed standards document");
    }

    @Test
    void missingResourceFailsTheLoad() {
        assertThatThrownBy(() -> loader.load(
                new ClassPathResource("fixtures/does-not-exist.json"),
                new ClassPathResource("fixtures/contributions.json")))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageStartingWith("Cannot read reference data");
    }

    private InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
