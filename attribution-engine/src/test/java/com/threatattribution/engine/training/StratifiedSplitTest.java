package com.threatattribution.engine.training;

import org.junit.jupiter.api.Test;
import smile.math.Random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class StratifiedSplitTest {

    @Test
    void shouldHoldOutTheSameShareOfEveryLabel() {
        List<String> labels = new ArrayList<>();
        labels.addAll(Collections.nCopies(100, "a"));
        labels.addAll(Collections.nCopies(50, "b"));

        StratifiedSplit split = StratifiedSplit.of(labels, 0.2, new Random(27));

        assertEquals(30, split.validationIndices().size());
        assertEquals(120, split.trainIndices().size());
        assertEquals(20, split.validationIndices().stream().filter(i -> labels.get(i).equals("a")).count());
        assertEquals(10, split.validationIndices().stream().filter(i -> labels.get(i).equals("b")).count());
    }

    @Test
    void partitionsShouldBeDisjointAndComplete() {
        List<String> labels = IntStream.range(0, 60).mapToObj(i -> "label" + (i % 3)).toList();

        StratifiedSplit split = StratifiedSplit.of(labels, 0.25, new Random(5));

        List<Integer> all = new ArrayList<>(split.trainIndices());
        all.addAll(split.validationIndices());
        Collections.sort(all);
        assertEquals(IntStream.range(0, 60).boxed().toList(), all);
    }

    @Test
    void smallLabelsShouldKeepOneRowOnEachSide() {
        StratifiedSplit split = StratifiedSplit.of(List.of("a", "a", "b", "b"), 0.1, new Random(1));

        assertEquals(2, split.validationIndices().size());
        assertEquals(2, split.trainIndices().size());
    }

    @Test
    void sameSeedShouldGiveSameSplit() {
        List<String> labels = IntStream.range(0, 40).mapToObj(i -> i % 2 == 0 ? "x" : "y").toList();

        assertEquals(StratifiedSplit.of(labels, 0.2, new Random(27)), StratifiedSplit.of(labels, 0.2, new Random(27)));
    }

    @Test
    void shouldRejectSingletonLabels() {
        assertThrows(IllegalArgumentException.class,
                () -> StratifiedSplit.of(List.of("a", "a", "b"), 0.2, new Random(1)));
    }
}
