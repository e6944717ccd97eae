package com.threatattribution.engine.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatattribution.engine.config.AttributionProperties;
import com.threatattribution.engine.model.NaiveBayesAttributionModel;
import com.threatattribution.engine.stix.InputFormatException;
import com.threatattribution.engine.stix.IntrusionSetParser;
import com.threatattribution.engine.stix.IntrusionSetProfile;
import com.threatattribution.engine.version.DatabaseVersion;
import com.threatattribution.engine.version.VersionIncrement;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.math.Random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Trains the attribution model on synthetic incidents generated from a corpus
 * of intrusion-set bundles.
 *
 * <p>
 * Pipeline:
 * </p>
 * <ol>
 * <li>parse every bundle into an {@link IntrusionSetProfile};</li>
 * <li>generate {@code samplesPerLabel} incidents per intrusion set;</li>
 * <li>hold out a stratified validation partition;</li>
 * <li>fit a Bernoulli Naive Bayes model on the rest;</li>
 * <li>score the validation partition and bump the database version.</li>
 * </ol>
 * <p>
 * Runs are reproducible for a fixed seed and corpus order. A failed run throws;
 * it never returns a partially trained model.
 * </p>
 *
 * @author Naveed Gung
 */
public class AttributionTrainer {

    private static final Logger log = LoggerFactory.getLogger(AttributionTrainer.class);

    private final List<JsonNode> intrusionSetsData;
    private final DatabaseVersion databaseVersion;
    private final AttributionProperties properties;
    private final IntrusionSetParser parser;

    public AttributionTrainer(List<JsonNode> intrusionSetsData) {
        this(intrusionSetsData, DatabaseVersion.DEFAULT, new AttributionProperties(), new IntrusionSetParser());
    }

    public AttributionTrainer(List<JsonNode> intrusionSetsData, DatabaseVersion databaseVersion) {
        this(intrusionSetsData, databaseVersion, new AttributionProperties(), new IntrusionSetParser());
    }

    public AttributionTrainer(
            List<JsonNode> intrusionSetsData,
            DatabaseVersion databaseVersion,
            AttributionProperties properties,
            IntrusionSetParser parser) {
        this.intrusionSetsData = intrusionSetsData == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(intrusionSetsData));
        this.databaseVersion = databaseVersion;
        this.properties = properties;
        this.parser = parser;
        log.info("The number of intrusion set items {}", this.intrusionSetsData.size());
        log.info("The data version is {}", databaseVersion);
    }

    /** Retrain and bump the patch component of the database version. */
    public TrainingOutcome retrain() {
        return retrain(VersionIncrement.PATCH);
    }

    /**
     * Retrain the model.
     *
     * @param increment which version component the new model bumps
     * @return the model, its validation F1 and its new version
     * @throws TrainingDataException     if the corpus is empty or malformed
     * @throws TrainingInternalException if fitting or evaluation fails
     */
    public TrainingOutcome retrain(VersionIncrement increment) {
        try {
            LabelledIncidents incidents = createIncidentData();
            long distinctLabels = incidents.labels().stream().distinct().count();
            if (distinctLabels < 2) {
                throw new TrainingInternalException(
                        "Cannot train a classifier on " + distinctLabels + " distinct label(s)");
            }

            AttributionProperties.Training training = properties.getTraining();
            StratifiedSplit split = StratifiedSplit.of(incidents.labels(), training.getTestSize(),
                    new Random(training.getRandomSeed()));
            LabelledIncidents trainSet = incidents.select(split.trainIndices());
            LabelledIncidents validationSet = incidents.select(split.validationIndices());

            NaiveBayesAttributionModel model = NaiveBayesAttributionModel.fit(
                    trainSet.documents(), trainSet.labels(), training.getSmoothing());

            List<String> predicted = new ArrayList<>(validationSet.size());
            for (String document : validationSet.documents()) {
                predicted.add(model.predict(document));
            }
            EvaluationMetrics metrics = EvaluationMetrics.evaluate(validationSet.labels(), predicted,
                    trainSet.size(), (int) distinctLabels);
            if (Double.isNaN(metrics.weightedF1())) {
                throw new TrainingInternalException("Validation F1 is not a number");
            }

            DatabaseVersion newVersion = databaseVersion.increment(increment);
            log.info("Training complete: labels={} train={} validation={} weightedF1={} macroF1={} version {} -> {}",
                    distinctLabels, trainSet.size(), validationSet.size(),
                    String.format("%.4f", metrics.weightedF1()), String.format("%.4f", metrics.macroF1()),
                    databaseVersion, newVersion);
            return new TrainingOutcome(model, metrics.weightedF1(), newVersion, metrics);

        } catch (TrainingDataException | TrainingInternalException e) {
            log.error("Training failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Training failed with an unexpected error: {}", e.getMessage(), e);
            throw new TrainingInternalException("Training failed: " + e.getMessage(), e);
        }
    }

    /**
     * Generate the labelled incident dataset from the corpus.
     *
     * @return documents and labels, grouped by intrusion set in corpus order
     * @throws TrainingDataException if the corpus is empty or malformed
     */
    public LabelledIncidents createIncidentData() {
        List<IntrusionSetProfile> profiles = loadProfiles();
        IncidentGenerator generator = new IncidentGenerator(properties.getGenerator(),
                new Well19937c(properties.getTraining().getRandomSeed()));
        int samplesPerLabel = properties.getTraining().getSamplesPerLabel();

        List<String> documents = new ArrayList<>(profiles.size() * samplesPerLabel);
        List<String> labels = new ArrayList<>(profiles.size() * samplesPerLabel);
        for (IntrusionSetProfile profile : profiles) {
            for (int i = 0; i < samplesPerLabel; i++) {
                documents.add(String.join(" ", generator.generate(profile)));
                labels.add(profile.getLabel());
            }
        }
        log.debug("Generated {} incidents for {} intrusion sets", documents.size(), profiles.size());
        return new LabelledIncidents(documents, labels);
    }

    private List<IntrusionSetProfile> loadProfiles() {
        if (intrusionSetsData.isEmpty()) {
            throw new TrainingDataException("Intrusion set corpus is empty");
        }

        Map<String, IntrusionSetProfile> profiles;
        try {
            profiles = parser.parseAll(intrusionSetsData);
        } catch (InputFormatException e) {
            throw new TrainingDataException("Malformed intrusion set bundle: " + e.getMessage(), e);
        }
        for (IntrusionSetProfile profile : profiles.values()) {
            if (!profile.hasWellFormedLabel()) {
                throw new TrainingDataException("Malformed intrusion set identifier: " + profile.getLabel());
            }
            if (profile.isEmpty()) {
                throw new TrainingDataException("Intrusion set " + profile.getLabel() + " has no related entities");
            }
        }
        return new ArrayList<>(profiles.values());
    }

    /**
     * Parallel document and label columns.
     *
     * @param documents feature strings
     * @param labels    intrusion set labels
     */
    public record LabelledIncidents(List<String> documents, List<String> labels) {

        public int size() {
            return documents.size();
        }

        LabelledIncidents select(List<Integer> rows) {
            List<String> selectedDocuments = new ArrayList<>(rows.size());
            List<String> selectedLabels = new ArrayList<>(rows.size());
            for (int row : rows) {
                selectedDocuments.add(documents.get(row));
                selectedLabels.add(labels.get(row));
            }
            return new LabelledIncidents(selectedDocuments, selectedLabels);
        }
    }
}
