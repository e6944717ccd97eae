package com.threatattribution.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatattribution.engine.model.ModelArtifactLoader;
import com.threatattribution.engine.version.DatabaseVersion;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring for the attribution pipeline.
 *
 * @author Naveed Gung
 */
@Configuration
@EnableConfigurationProperties(AttributionProperties.class)
public class AttributionConfig {

    @Bean
    public ModelArtifactLoader modelArtifactLoader(ObjectMapper objectMapper, AttributionProperties properties) {
        return new ModelArtifactLoader(objectMapper,
                properties.getModel().getModelFileName(),
                properties.getModel().getMetaFileName());
    }

    /** Version reported when no model has been registered yet. */
    @Bean
    public DatabaseVersion defaultDatabaseVersion(AttributionProperties properties) {
        return DatabaseVersion.parse(properties.getDefaultDatabaseVersion());
    }
}
