package com.threatattribution.engine.training;

import smile.math.Random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index partition of a labelled dataset into training and validation sets
 * that keeps every label's share roughly equal in both.
 *
 * @param trainIndices      row indices used for fitting, ascending
 * @param validationIndices row indices held out for evaluation, ascending
 *
 * @author Naveed Gung
 */
public record StratifiedSplit(List<Integer> trainIndices, List<Integer> validationIndices) {

    /**
     * Split a label column.
     *
     * <p>
     * For each label the row indices are permuted with Smile's seeded
     * generator and {@code max(1, round(count * testSize))} of them are held
     * out; at least one row per label always remains for training.
     * </p>
     *
     * @param labels   one label per row
     * @param testSize fraction to hold out, in (0, 1)
     * @param random   source of the permutation
     * @return the split
     * @throws IllegalArgumentException if a label has fewer than two rows
     */
    public static StratifiedSplit of(List<String> labels, double testSize, Random random) {
        Map<String, List<Integer>> byLabel = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            byLabel.computeIfAbsent(labels.get(i), k -> new ArrayList<>()).add(i);
        }

        List<Integer> train = new ArrayList<>();
        List<Integer> validation = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> entry : byLabel.entrySet()) {
            List<Integer> rows = entry.getValue();
            if (rows.size() < 2) {
                throw new IllegalArgumentException(
                        "Label " + entry.getKey() + " has " + rows.size() + " row(s); stratification needs at least 2");
            }
            int[] order = rows.stream().mapToInt(Integer::intValue).toArray();
            random.permutate(order);
            int held = (int) Math.round(order.length * testSize);
            held = Math.min(Math.max(1, held), order.length - 1);
            for (int i = 0; i < order.length; i++) {
                (i < held ? validation : train).add(order[i]);
            }
        }
        Collections.sort(train);
        Collections.sort(validation);
        return new StratifiedSplit(List.copyOf(train), List.copyOf(validation));
    }
}
