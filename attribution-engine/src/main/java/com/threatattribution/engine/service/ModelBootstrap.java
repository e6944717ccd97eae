package com.threatattribution.engine.service;

import com.threatattribution.engine.config.AttributionProperties;
import com.threatattribution.engine.model.ModelArtifactLoader;
import com.threatattribution.engine.version.ModelRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads the default model artifact into the registry at startup.
 *
 * <p>
 * When {@code attribution.model.artifact-path} is unset or unreadable the
 * registry stays empty and predictions report the model as unavailable until
 * a model is trained.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ModelBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ModelBootstrap.class);

    private final AttributionProperties properties;
    private final ModelArtifactLoader loader;
    private final ModelRegistry registry;

    public ModelBootstrap(AttributionProperties properties, ModelArtifactLoader loader, ModelRegistry registry) {
        this.properties = properties;
        this.loader = loader;
        this.registry = registry;
    }

    @PostConstruct
    public void loadDefaultModel() {
        String artifactPath = properties.getModel().getArtifactPath();
        if (artifactPath == null || artifactPath.isBlank()) {
            log.info("No default model artifact configured");
            return;
        }
        loader.load(Path.of(artifactPath)).ifPresentOrElse(
                registry::register,
                () -> log.warn("Default model artifact at {} is unavailable", artifactPath));
    }
}
