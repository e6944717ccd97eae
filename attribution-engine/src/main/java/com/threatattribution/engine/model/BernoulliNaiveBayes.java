package com.threatattribution.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import smile.classification.DiscreteNaiveBayes;
import smile.util.IntSet;

import java.util.List;
import java.util.TreeMap;

/**
 * Naive Bayes classifier for multivariate Bernoulli (binary presence) features,
 * backed by Smile's {@link DiscreteNaiveBayes} in
 * {@link DiscreteNaiveBayes.Model#BERNOULLI} mode.
 *
 * <p>
 * Per-class feature probabilities use additive smoothing,
 * {@code P(x_j = 1 | c) = (N_cj + alpha) / (N_c + 2 alpha)}, and class priors
 * are the empirical class frequencies. Absent features also contribute to the
 * likelihood through {@code log(1 - p)}.
 * </p>
 *
 * <p>
 * A Bernoulli model depends only on how many documents each class has and how
 * many of them contain each feature. Those counts are what gets persisted; the
 * Smile model is rebuilt from them on construction.
 * </p>
 *
 * @author Naveed Gung
 */
public final class BernoulliNaiveBayes {

    private final String[] classes;
    private final double smoothing;
    private final int[] classCounts;
    private final int[][] featureCounts;
    private final int numFeatures;

    private final DiscreteNaiveBayes model;

    @JsonCreator
    public BernoulliNaiveBayes(
            @JsonProperty("classes") String[] classes,
            @JsonProperty("smoothing") double smoothing,
            @JsonProperty("classCounts") int[] classCounts,
            @JsonProperty("featureCounts") int[][] featureCounts) {
        if (classes.length != classCounts.length || classes.length != featureCounts.length) {
            throw new IllegalArgumentException("Inconsistent class dimensions: " + classes.length + " classes, "
                    + classCounts.length + " class counts, " + featureCounts.length + " feature count rows");
        }
        if (!(smoothing > 0.0)) {
            throw new IllegalArgumentException("Smoothing must be positive, got " + smoothing);
        }
        this.classes = classes.clone();
        this.smoothing = smoothing;
        this.classCounts = classCounts.clone();
        this.featureCounts = new int[featureCounts.length][];
        this.numFeatures = featureCounts.length == 0 ? 0 : featureCounts[0].length;
        for (int c = 0; c < featureCounts.length; c++) {
            if (featureCounts[c].length != numFeatures) {
                throw new IllegalArgumentException("Feature count row " + c + " has " + featureCounts[c].length
                        + " entries, expected " + numFeatures);
            }
            for (int j = 0; j < numFeatures; j++) {
                if (featureCounts[c][j] < 0 || featureCounts[c][j] > classCounts[c]) {
                    throw new IllegalArgumentException("Feature " + j + " of class " + classes[c] + " seen "
                            + featureCounts[c][j] + " times in " + classCounts[c] + " documents");
                }
            }
            this.featureCounts[c] = featureCounts[c].clone();
        }
        this.model = rebuild();
    }

    /**
     * Fit on binary samples.
     *
     * @param samples     feature indices present in each sample
     * @param labels      the label of each sample
     * @param numFeatures vocabulary size
     * @param alpha       additive smoothing, strictly positive
     * @return the fitted classifier, classes sorted lexically
     */
    public static BernoulliNaiveBayes fit(List<int[]> samples, List<String> labels, int numFeatures, double alpha) {
        if (samples.size() != labels.size()) {
            throw new IllegalArgumentException(
                    "Got " + samples.size() + " samples but " + labels.size() + " labels");
        }
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit on an empty sample set");
        }

        TreeMap<String, Integer> classIndex = new TreeMap<>();
        labels.forEach(label -> classIndex.putIfAbsent(label, 0));
        String[] classes = classIndex.keySet().toArray(new String[0]);
        for (int c = 0; c < classes.length; c++) {
            classIndex.put(classes[c], c);
        }

        int[] classCounts = new int[classes.length];
        int[][] featureCounts = new int[classes.length][numFeatures];
        for (int i = 0; i < samples.size(); i++) {
            int c = classIndex.get(labels.get(i));
            classCounts[c]++;
            for (int j : samples.get(i)) {
                featureCounts[c][j]++;
            }
        }
        return new BernoulliNaiveBayes(classes, alpha, classCounts, featureCounts);
    }

    /**
     * Posterior probability of each class.
     *
     * @param present sorted feature indices present in the sample
     * @return probabilities summing to one, aligned with {@link #getClasses()}
     */
    public double[] predictProba(int[] present) {
        double[] posteriori = new double[classes.length];
        model.predict(dense(present), posteriori);
        return posteriori;
    }

    /**
     * Replays the counts as synthetic documents: for class {@code c} the first
     * {@code featureCounts[c][j]} of its {@code classCounts[c]} documents carry
     * feature {@code j}. This reproduces every count Smile keeps.
     */
    private DiscreteNaiveBayes rebuild() {
        int total = 0;
        for (int count : classCounts) {
            total += count;
        }
        int[][] x = new int[total][];
        int[] y = new int[total];
        int row = 0;
        for (int c = 0; c < classes.length; c++) {
            for (int d = 0; d < classCounts[c]; d++) {
                int[] document = new int[numFeatures];
                for (int j = 0; j < numFeatures; j++) {
                    document[j] = d < featureCounts[c][j] ? 1 : 0;
                }
                x[row] = document;
                y[row] = c;
                row++;
            }
        }

        DiscreteNaiveBayes naiveBayes = new DiscreteNaiveBayes(
                DiscreteNaiveBayes.Model.BERNOULLI, classes.length, numFeatures, smoothing, IntSet.of(classes.length));
        naiveBayes.update(x, y);
        return naiveBayes;
    }

    private int[] dense(int[] present) {
        int[] x = new int[numFeatures];
        for (int j : present) {
            x[j] = 1;
        }
        return x;
    }

    @JsonProperty("classes")
    public String[] getClasses() {
        return classes.clone();
    }

    @JsonProperty("smoothing")
    public double getSmoothing() {
        return smoothing;
    }

    @JsonProperty("classCounts")
    public int[] getClassCounts() {
        return classCounts.clone();
    }

    @JsonProperty("featureCounts")
    public int[][] getFeatureCounts() {
        int[][] copy = new int[featureCounts.length][];
        for (int c = 0; c < featureCounts.length; c++) {
            copy[c] = featureCounts[c].clone();
        }
        return copy;
    }

    public int numFeatures() {
        return numFeatures;
    }
}
