package com.threatattribution.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference {@link AttributionModel}: a {@link BinaryTokenVectorizer} feeding a
 * {@link BernoulliNaiveBayes} classifier.
 *
 * @author Naveed Gung
 */
public final class NaiveBayesAttributionModel implements AttributionModel {

    private final BinaryTokenVectorizer vectorizer;
    private final BernoulliNaiveBayes classifier;
    private final List<String> classes;

    @JsonCreator
    public NaiveBayesAttributionModel(
            @JsonProperty("vectorizer") BinaryTokenVectorizer vectorizer,
            @JsonProperty("classifier") BernoulliNaiveBayes classifier) {
        if (classifier.numFeatures() != vectorizer.size() && classifier.getClasses().length > 0) {
            throw new IllegalArgumentException("Classifier expects " + classifier.numFeatures()
                    + " features but vocabulary has " + vectorizer.size());
        }
        this.vectorizer = vectorizer;
        this.classifier = classifier;
        this.classes = List.of(classifier.getClasses());
    }

    /**
     * Fit the vectorizer and classifier on a labelled corpus.
     *
     * @param documents feature strings
     * @param labels    one label per document
     * @param alpha     additive smoothing
     * @return the fitted model
     */
    public static NaiveBayesAttributionModel fit(List<String> documents, List<String> labels, double alpha) {
        BinaryTokenVectorizer vectorizer = BinaryTokenVectorizer.fit(documents);
        List<int[]> samples = new ArrayList<>(documents.size());
        for (String document : documents) {
            samples.add(vectorizer.transform(document));
        }
        BernoulliNaiveBayes classifier = BernoulliNaiveBayes.fit(samples, labels, vectorizer.size(), alpha);
        return new NaiveBayesAttributionModel(vectorizer, classifier);
    }

    @Override
    @JsonIgnore
    public List<String> classes() {
        return classes;
    }

    @Override
    public double[] predictProba(String features) {
        return classifier.predictProba(vectorizer.transform(features));
    }

    @JsonProperty("vectorizer")
    public BinaryTokenVectorizer getVectorizer() {
        return vectorizer;
    }

    @JsonProperty("classifier")
    public BernoulliNaiveBayes getClassifier() {
        return classifier;
    }
}
