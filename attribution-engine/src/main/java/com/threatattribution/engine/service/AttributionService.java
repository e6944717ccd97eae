package com.threatattribution.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatattribution.engine.AttributionException;
import com.threatattribution.engine.config.AttributionProperties;
import com.threatattribution.engine.metrics.AttributionMetrics;
import com.threatattribution.engine.prediction.AttributionPredictor;
import com.threatattribution.engine.prediction.PredictionResult;
import com.threatattribution.engine.stix.IncidentSerializer;
import com.threatattribution.engine.stix.IntrusionSetParser;
import com.threatattribution.engine.training.AttributionTrainer;
import com.threatattribution.engine.training.TrainingOutcome;
import com.threatattribution.engine.version.DatabaseVersion;
import com.threatattribution.engine.version.ModelRegistry;
import com.threatattribution.engine.version.ModelVersionConflictException;
import com.threatattribution.engine.version.VersionIncrement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Facade over the attribution pipeline: predicts with the registered model and
 * retrains it from intrusion-set bundles.
 *
 * @author Naveed Gung
 */
@Service
public class AttributionService {

    private static final Logger log = LoggerFactory.getLogger(AttributionService.class);

    private final ModelRegistry registry;
    private final IncidentSerializer serializer;
    private final IntrusionSetParser parser;
    private final AttributionProperties properties;
    private final AttributionMetrics metrics;
    private final DatabaseVersion defaultDatabaseVersion;

    /** Guards read-version, train, register as one step. */
    private final Object retrainLock = new Object();

    public AttributionService(
            ModelRegistry registry,
            IncidentSerializer serializer,
            IntrusionSetParser parser,
            AttributionProperties properties,
            AttributionMetrics metrics,
            DatabaseVersion defaultDatabaseVersion) {
        this.registry = registry;
        this.serializer = serializer;
        this.parser = parser;
        this.properties = properties;
        this.metrics = metrics;
        this.defaultDatabaseVersion = defaultDatabaseVersion;
    }

    /**
     * Attribute an incident with the registered model.
     *
     * @param incident STIX2 incident bundle or serialized feature string
     * @return the ranked labels, or a failure status
     */
    public PredictionResult attribute(String incident) {
        AttributionPredictor predictor = currentPredictor();
        return metrics.recordPrediction(() -> predictor.predict(incident));
    }

    /**
     * Attribute a parsed incident with the registered model.
     *
     * @param incident STIX2 incident bundle
     * @return the ranked labels, or a failure status
     */
    public PredictionResult attribute(JsonNode incident) {
        AttributionPredictor predictor = currentPredictor();
        return metrics.recordPrediction(() -> predictor.predict(incident));
    }

    /**
     * Retrain from a corpus and make the new model current.
     *
     * <p>
     * Concurrent calls are serialized, so each run starts from the version the
     * previous one registered.
     * </p>
     *
     * @param intrusionSetsData intrusion-set bundles
     * @param increment         version component to bump
     * @return the training outcome
     * @throws AttributionException if training fails or the new model cannot be
     *                              registered; the registered model is left
     *                              unchanged
     */
    public TrainingOutcome retrain(List<JsonNode> intrusionSetsData, VersionIncrement increment) {
        synchronized (retrainLock) {
            DatabaseVersion current = currentVersion();
            AttributionTrainer trainer = new AttributionTrainer(intrusionSetsData, current, properties, parser);

            TrainingOutcome outcome;
            try {
                outcome = trainer.retrain(increment);
                registry.register(outcome.toVersionedModel());
            } catch (IllegalStateException e) {
                metrics.recordTrainingFailure();
                log.error("Trained model was not registered: {}", e.getMessage());
                throw new ModelVersionConflictException("Trained model was not registered: " + e.getMessage(), e);
            } catch (AttributionException e) {
                metrics.recordTrainingFailure();
                throw e;
            }

            metrics.recordTraining(outcome);
            log.info("Model retrained: version {} -> {} (f1={})", current, outcome.newVersion(),
                    String.format("%.4f", outcome.f1Score()));
            return outcome;
        }
    }

    /** Version of the registered model, or the configured default. */
    public DatabaseVersion currentVersion() {
        return registry.currentVersion().orElse(defaultDatabaseVersion);
    }

    private AttributionPredictor currentPredictor() {
        return AttributionPredictor.of(registry.current(), defaultDatabaseVersion, properties.getTopN(), serializer);
    }
}
