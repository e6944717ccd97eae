package com.threatattribution.engine.model;

import java.util.List;

/**
 * A fitted probabilistic classifier over intrusion-set labels.
 *
 * <p>
 * Implementations are immutable once built and safe for concurrent use.
 * </p>
 *
 * @author Naveed Gung
 */
public interface AttributionModel {

    /**
     * The label space, sorted lexically. Index {@code i} of
     * {@link #predictProba(String)} refers to {@code classes().get(i)}.
     */
    List<String> classes();

    /**
     * Score a feature string against every label.
     *
     * @param features the serialized incident
     * @return one probability in [0, 1] per label
     */
    double[] predictProba(String features);

    /**
     * Most probable label; ties resolve to the lexically smallest label.
     *
     * @param features the serialized incident
     * @return the predicted label
     */
    default String predict(String features) {
        double[] probas = predictProba(features);
        int best = 0;
        for (int i = 1; i < probas.length; i++) {
            if (probas[i] > probas[best]) {
                best = i;
            }
        }
        return classes().get(best);
    }
}
