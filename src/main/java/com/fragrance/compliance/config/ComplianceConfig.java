package com.fragrance.compliance.config;

import com.fragrance.compliance.data.ReferenceDataLoader;
import com.fragrance.compliance.domain.ComplianceParams;
import com.fragrance.compliance.domain.ReferenceData;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class ComplianceConfig {

    @Bean
    public ReferenceData referenceData(ReferenceDataLoader loader, ResourceLoader resourceLoader,
                                       ComplianceProperties properties) {
        ComplianceProperties.ReferenceDataLocations locations = properties.referenceData();
        return loader.load(
                resourceLoader.getResource(locations.standards()),
                resourceLoader.getResource(locations.contributions()));
    }

    @Bean
    public ComplianceParams complianceParams(ComplianceProperties properties) {
        return properties.toParams();
    }
}
