package com.threatattribution.engine.prediction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatattribution.engine.model.AttributionModel;
import com.threatattribution.engine.stix.IncidentSerializer;
import com.threatattribution.engine.stix.InputFormatException;
import com.threatattribution.engine.version.DatabaseVersion;
import com.threatattribution.engine.version.VersionedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Attributes incidents to intrusion sets with a trained model.
 *
 * <p>
 * Checks run in a fixed order and the first failing one decides the result:
 * </p>
 * <ol>
 * <li>no model was supplied: {@link PredictionStatus#MODEL_UNAVAILABLE}</li>
 * <li>the incident cannot be serialized: {@link PredictionStatus#INVALID_INPUT}</li>
 * <li>scoring throws: {@link PredictionStatus#INTERNAL_ERROR}</li>
 * </ol>
 * <p>
 * {@code predict} never throws. The database version is echoed as supplied;
 * it is not checked against the model's provenance. Instances are immutable
 * and may be shared between threads.
 * </p>
 *
 * @author Naveed Gung
 */
public class AttributionPredictor {

    private static final Logger log = LoggerFactory.getLogger(AttributionPredictor.class);

    public static final int DEFAULT_TOP_N = 3;

    private final AttributionModel model;
    private final String dbVersion;
    private final int topN;
    private final IncidentSerializer serializer;

    public AttributionPredictor(Optional<AttributionModel> model, DatabaseVersion databaseVersion) {
        this(model, databaseVersion, DEFAULT_TOP_N, new IncidentSerializer(new ObjectMapper()));
    }

    public AttributionPredictor(
            Optional<AttributionModel> model,
            DatabaseVersion databaseVersion,
            int topN,
            IncidentSerializer serializer) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, got " + topN);
        }
        this.model = model.orElse(null);
        this.dbVersion = databaseVersion.toString();
        this.topN = topN;
        this.serializer = serializer;
        if (this.model == null) {
            log.warn("Predictor for database version {} created without a model", dbVersion);
        }
    }

    /**
     * Predictor over a registered model, or a model-less predictor reporting
     * {@code fallbackVersion} when nothing is registered.
     */
    public static AttributionPredictor of(Optional<VersionedModel> versionedModel, DatabaseVersion fallbackVersion,
            int topN, IncidentSerializer serializer) {
        return new AttributionPredictor(
                versionedModel.map(VersionedModel::model),
                versionedModel.map(VersionedModel::version).orElse(fallbackVersion),
                topN,
                serializer);
    }

    /**
     * Attribute an incident given as text.
     *
     * <p>
     * Text starting with <code>{</code> is parsed as a STIX2 incident bundle;
     * anything else is taken as an already serialized feature string.
     * </p>
     *
     * @param incident the incident document or feature string
     * @return the ranked labels or a failure status
     */
    public PredictionResult predict(String incident) {
        if (model == null) {
            return PredictionResult.failure(PredictionStatus.MODEL_UNAVAILABLE, dbVersion);
        }
        if (incident == null || incident.isBlank()) {
            return PredictionResult.failure(PredictionStatus.INVALID_INPUT, dbVersion);
        }

        String features;
        String trimmed = incident.trim();
        if (trimmed.startsWith("{")) {
            try {
                features = serializer.serialize(trimmed);
            } catch (InputFormatException e) {
                log.warn("Incident cannot be serialized: {}", e.getMessage());
                return PredictionResult.failure(PredictionStatus.INVALID_INPUT, dbVersion);
            }
        } else {
            features = IncidentSerializer.normalize(trimmed);
        }
        return score(features);
    }

    /**
     * Attribute a parsed incident bundle.
     *
     * @param incident the incident bundle
     * @return the ranked labels or a failure status
     */
    public PredictionResult predict(JsonNode incident) {
        if (model == null) {
            return PredictionResult.failure(PredictionStatus.MODEL_UNAVAILABLE, dbVersion);
        }
        String features;
        try {
            features = serializer.serialize(incident);
        } catch (InputFormatException e) {
            log.warn("Incident cannot be serialized: {}", e.getMessage());
            return PredictionResult.failure(PredictionStatus.INVALID_INPUT, dbVersion);
        }
        return score(features);
    }

    /**
     * Attribute an incident and render the wire document.
     *
     * @param incident the incident document or feature string
     * @return the result JSON as a string
     */
    public String predictJson(String incident) {
        return predict(incident).toJson().toString();
    }

    public String getDbVersion() {
        return dbVersion;
    }

    public boolean hasModel() {
        return model != null;
    }

    private PredictionResult score(String features) {
        if (features.isEmpty()) {
            return PredictionResult.failure(PredictionStatus.INVALID_INPUT, dbVersion);
        }
        try {
            List<String> classes = model.classes();
            double[] probas = model.predictProba(features);
            if (probas.length != classes.size()) {
                throw new IllegalStateException(
                        "Model returned " + probas.length + " scores for " + classes.size() + " labels");
            }
            for (double p : probas) {
                if (Double.isNaN(p)) {
                    throw new IllegalStateException("Model returned a NaN score");
                }
            }

            List<Integer> ranked = IntStream.range(0, probas.length).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(i -> -probas[i])
                            .thenComparing(classes::get))
                    .limit(topN)
                    .toList();

            List<String> labels = new ArrayList<>(ranked.size());
            List<Double> scores = new ArrayList<>(ranked.size());
            for (int i : ranked) {
                labels.add(classes.get(i));
                scores.add(Math.min(1.0, Math.max(0.0, probas[i])));
            }
            return PredictionResult.success(labels, scores, dbVersion);

        } catch (RuntimeException e) {
            log.warn("The exception happened and the score can not be predicted for '{}'", features, e);
            return PredictionResult.failure(PredictionStatus.INTERNAL_ERROR, dbVersion);
        }
    }
}
