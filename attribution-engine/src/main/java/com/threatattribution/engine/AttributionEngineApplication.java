package com.threatattribution.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Threat Attribution Engine.
 *
 * <p>
 * Spring Boot application that serializes STIX2 incidents into feature
 * strings, trains a Naive Bayes attribution model from intrusion-set bundles
 * and ranks the intrusion sets most likely behind an incident.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
public class AttributionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttributionEngineApplication.class, args);
    }
}
