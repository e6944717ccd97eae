package com.threatattribution.engine.training;

import smile.validation.metric.Accuracy;
import smile.validation.metric.ConfusionMatrix;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Quality of a trained model on its validation partition, scored from a Smile
 * {@link ConfusionMatrix}.
 *
 * @param weightedF1     per-label F1 averaged by label support
 * @param macroF1        unweighted mean of per-label F1
 * @param accuracy       fraction of validation rows predicted correctly
 * @param trainSize      rows used for fitting
 * @param validationSize rows held out
 * @param labelCount     distinct labels in the training data
 *
 * @author Naveed Gung
 */
public record EvaluationMetrics(
        double weightedF1,
        double macroF1,
        double accuracy,
        int trainSize,
        int validationSize,
        int labelCount) {

    /**
     * Score predictions against the truth. Labels that are only ever predicted
     * count towards the macro average with an F1 of zero; precision or recall
     * with a zero denominator is taken as zero.
     *
     * @param truth          expected labels
     * @param predicted      predicted labels, aligned with {@code truth}
     * @param trainSize      rows used for fitting
     * @param labelCount     distinct labels in the training data
     * @return the metrics, every score in [0, 1]
     */
    public static EvaluationMetrics evaluate(List<String> truth, List<String> predicted, int trainSize,
            int labelCount) {
        if (truth.size() != predicted.size()) {
            throw new IllegalArgumentException(
                    "Got " + truth.size() + " expected labels but " + predicted.size() + " predictions");
        }
        if (truth.isEmpty()) {
            throw new IllegalArgumentException("Cannot evaluate on an empty validation set");
        }

        TreeSet<String> labels = new TreeSet<>(truth);
        labels.addAll(predicted);
        Map<String, Integer> labelIndex = new HashMap<>();
        for (String label : labels) {
            labelIndex.put(label, labelIndex.size());
        }
        int[] expected = truth.stream().mapToInt(labelIndex::get).toArray();
        int[] actual = predicted.stream().mapToInt(labelIndex::get).toArray();

        int[][] matrix = ConfusionMatrix.of(expected, actual).matrix;
        double weightedSum = 0.0;
        double macroSum = 0.0;
        for (int c = 0; c < labels.size(); c++) {
            int tp = matrix[c][c];
            int support = 0;
            int predictedCount = 0;
            for (int other = 0; other < labels.size(); other++) {
                support += matrix[c][other];
                predictedCount += matrix[other][c];
            }
            double precision = predictedCount == 0 ? 0.0 : (double) tp / predictedCount;
            double recall = support == 0 ? 0.0 : (double) tp / support;
            double f1 = precision + recall == 0.0 ? 0.0 : 2.0 * precision * recall / (precision + recall);
            weightedSum += f1 * support;
            macroSum += f1;
        }

        return new EvaluationMetrics(
                clamp(weightedSum / truth.size()),
                clamp(macroSum / labels.size()),
                Accuracy.of(expected, actual),
                trainSize,
                truth.size(),
                labelCount);
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
