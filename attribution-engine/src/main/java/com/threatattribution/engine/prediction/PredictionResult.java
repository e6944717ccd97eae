package com.threatattribution.engine.prediction;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of attributing one incident.
 *
 * <p>
 * On success {@code labels} holds up to N intrusion-set labels ranked by
 * descending probability and {@code probas} their probabilities. On failure
 * both lists are empty and {@code status} tells why. In every case
 * {@code dbVersion} echoes the database version the predictor was built with.
 * </p>
 *
 * <p>
 * Wire form ({@link #toJson()}):
 * </p>
 *
 * <pre>
 * {"label": {"labels": ["Aggah_intrusion-set--...", ...], "probas": [0.95, ...]}, "db_version": "(0, 0, 1)"}
 * {"label": -2, "db_version": "(0, 0, 1)"}
 * </pre>
 *
 * @param status    outcome of the call
 * @param labels    ranked labels, empty on failure
 * @param probas    probabilities aligned with {@code labels}, each in [0, 1]
 * @param dbVersion database version string
 *
 * @author Naveed Gung
 */
public record PredictionResult(
        PredictionStatus status,
        List<String> labels,
        List<Double> probas,
        String dbVersion) {

    public PredictionResult {
        labels = List.copyOf(labels);
        probas = List.copyOf(probas);
        if (labels.size() != probas.size()) {
            throw new IllegalArgumentException(
                    "Got " + labels.size() + " labels but " + probas.size() + " probabilities");
        }
    }

    /** Factory for a ranked prediction. */
    public static PredictionResult success(List<String> labels, List<Double> probas, String dbVersion) {
        return new PredictionResult(PredictionStatus.OK, labels, probas, dbVersion);
    }

    /** Factory for a failed prediction. */
    public static PredictionResult failure(PredictionStatus status, String dbVersion) {
        if (status == PredictionStatus.OK) {
            throw new IllegalArgumentException("A failure needs a failure status");
        }
        return new PredictionResult(status, List.of(), List.of(), dbVersion);
    }

    public boolean isSuccess() {
        return status == PredictionStatus.OK;
    }

    /** The top-ranked label, or null on failure or when no label was returned. */
    public String topLabel() {
        return labels.isEmpty() ? null : labels.get(0);
    }

    /** Render the wire document. */
    public ObjectNode toJson() {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode root = factory.objectNode();
        if (isSuccess()) {
            ObjectNode label = root.putObject("label");
            ArrayNode labelArray = label.putArray("labels");
            labels.forEach(labelArray::add);
            ArrayNode probaArray = label.putArray("probas");
            probas.forEach(probaArray::add);
        } else {
            root.put("label", status.getWireCode());
        }
        root.put("db_version", dbVersion);
        return root;
    }
}
