package com.threatattribution.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps feature strings to binary presence vectors over a fixed vocabulary.
 *
 * <p>
 * Tokens are the space-separated semantic ids of a feature string, lower-cased.
 * The vocabulary is sorted, so the same training documents always produce the
 * same feature indices. Tokens outside the vocabulary are ignored.
 * </p>
 *
 * @author Naveed Gung
 */
public final class BinaryTokenVectorizer {

    private final List<String> vocabulary;
    private final Map<String, Integer> index;

    @JsonCreator
    public BinaryTokenVectorizer(@JsonProperty("vocabulary") List<String> vocabulary) {
        this.vocabulary = List.copyOf(vocabulary);
        this.index = new HashMap<>(vocabulary.size() * 2);
        for (int i = 0; i < this.vocabulary.size(); i++) {
            index.put(this.vocabulary.get(i), i);
        }
    }

    /**
     * Learn the vocabulary of a corpus.
     *
     * @param documents feature strings
     * @return a vectorizer over every token seen
     */
    public static BinaryTokenVectorizer fit(List<String> documents) {
        TreeSet<String> tokens = new TreeSet<>();
        for (String document : documents) {
            tokens.addAll(tokenize(document));
        }
        return new BinaryTokenVectorizer(new ArrayList<>(tokens));
    }

    /**
     * Indices of the vocabulary tokens present in a document.
     *
     * @param document a feature string
     * @return sorted, distinct feature indices
     */
    public int[] transform(String document) {
        return tokenize(document).stream()
                .map(index::get)
                .filter(i -> i != null)
                .mapToInt(Integer::intValue)
                .distinct()
                .sorted()
                .toArray();
    }

    static List<String> tokenize(String document) {
        if (document == null || document.isBlank()) {
            return List.of();
        }
        return Arrays.stream(document.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    @JsonProperty("vocabulary")
    public List<String> getVocabulary() {
        return vocabulary;
    }

    public int size() {
        return vocabulary.size();
    }
}
