package com.threatattribution.engine.training;

import com.threatattribution.engine.model.NaiveBayesAttributionModel;
import com.threatattribution.engine.version.DatabaseVersion;
import com.threatattribution.engine.version.VersionedModel;

/**
 * Result of a successful retraining run.
 *
 * @param model      the fitted model, ready for prediction
 * @param f1Score    weighted F1 on the validation partition, in [0, 1]
 * @param newVersion database version the model is bound to
 * @param metrics    full evaluation figures
 *
 * @author Naveed Gung
 */
public record TrainingOutcome(
        NaiveBayesAttributionModel model,
        double f1Score,
        DatabaseVersion newVersion,
        EvaluationMetrics metrics) {

    public VersionedModel toVersionedModel() {
        return VersionedModel.of(model, newVersion);
    }
}
