package com.fragrance.compliance.config;

import com.fragrance.compliance.domain.ComplianceParams;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "compliance")
public record ComplianceProperties(
        @NotNull ReferenceDataLocations referenceData,
        Integer maxResolutionDepth,
        Double integrityThresholdPercent,
        Double passTolerance,
        List<String> exemptionTokens,
        List<String> dilutionMarkers,
        Demo demo
) {
    public record ReferenceDataLocations(
            @NotBlank String standards,
            @NotBlank String contributions
    ) {
    }

    public record Demo(
            boolean enabled
    ) {
    }

    /**
     * Engine tunables, falling back to the IFRA category 4 defaults for anything not configured.
     */
    public ComplianceParams toParams() {
        ComplianceParams defaults = ComplianceParams.defaults();
        return defaults.toBuilder()
                .maxResolutionDepth(maxResolutionDepth == null ? defaults.getMaxResolutionDepth() : maxResolutionDepth)
                .integrityThresholdPercent(integrityThresholdPercent == null
                        ? defaults.getIntegrityThresholdPercent() : integrityThresholdPercent)
                .passTolerance(passTolerance == null ? defaults.getPassTolerance() : passTolerance)
                .exemptionTokens(exemptionTokens == null ? defaults.getExemptionTokens() : List.copyOf(exemptionTokens))
                .dilutionMarkers(dilutionMarkers == null ? defaults.getDilutionMarkers() : List.copyOf(dilutionMarkers))
                .build();
    }
}
