package com.threatattribution.engine.training;

import com.threatattribution.engine.config.AttributionProperties;
import com.threatattribution.engine.stix.IntrusionSetProfile;
import com.threatattribution.engine.stix.StixEntity;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generates synthetic incidents from an intrusion set profile.
 *
 * <p>
 * An incident is a bag of semantic ids an analyst could plausibly observe when
 * the intrusion set is active. Its size follows a beta-binomial distribution
 * skewed towards small incidents, capped by the number of entities the
 * intrusion set is known for. The content is split by type:
 * </p>
 * <ul>
 * <li>attack patterns: {@code ceil(size * 0.5)} draws with replacement</li>
 * <li>tools: {@code ceil(size * 0.2)} draws with replacement</li>
 * <li>malware: {@code ceil(size * 0.2)} draws with replacement</li>
 * <li>indicators, vulnerabilities, identities, locations:
 * {@code ceil(size * 0.1)} draws without replacement</li>
 * </ul>
 * <p>
 * Duplicate draws collapse, so incidents are usually smaller than the drawn
 * size. All randomness comes from the supplied {@link RandomGenerator}, so a
 * fixed seed reproduces the same incidents.
 * </p>
 *
 * @author Naveed Gung
 */
public class IncidentGenerator {

    private final AttributionProperties.Generator settings;
    private final RandomGenerator random;
    private final EnumeratedIntegerDistribution sizeDistribution;

    public IncidentGenerator(AttributionProperties.Generator settings, RandomGenerator random) {
        if (settings.getMaxIncidentSize() <= settings.getMinIncidentSize()) {
            throw new IllegalArgumentException(String.format("Wrong incident size bounds: %d, %d",
                    settings.getMinIncidentSize(), settings.getMaxIncidentSize()));
        }
        this.settings = settings;
        this.random = random;

        int span = settings.getMaxIncidentSize() - settings.getMinIncidentSize();
        int[] sizes = new int[span];
        for (int k = 0; k < span; k++) {
            sizes[k] = settings.getMinIncidentSize() + k;
        }
        this.sizeDistribution = new EnumeratedIntegerDistribution(random, sizes,
                betaBinomialPmf(span, settings.getBetaAlpha(), settings.getBetaBeta()));
    }

    /**
     * Generate one incident.
     *
     * @param source the intrusion set to imitate
     * @return semantic ids of the incident, possibly empty
     */
    public List<String> generate(IntrusionSetProfile source) {
        int sizeCap = Math.max(source.entityCount(), settings.getMinIncidentSize());
        int size = Math.min(nextIncidentSize(), sizeCap);

        List<String> content = new ArrayList<>();
        content.addAll(sampleWithReplacement(source.getAttackPatterns(), size, settings.getAttackPatternFraction()));
        content.addAll(sampleWithReplacement(source.getTools(), size, settings.getToolFraction()));
        content.addAll(sampleWithReplacement(source.getMalwares(), size, settings.getMalwareFraction()));
        content.addAll(sampleWithoutReplacement(source.getOthers(), size, settings.getOtherFraction()));
        return content;
    }

    /** Draw an incident size in {@code [minIncidentSize, maxIncidentSize)}. */
    int nextIncidentSize() {
        return sizeDistribution.sample();
    }

    private List<String> sampleWithReplacement(List<StixEntity> source, int size, double fraction) {
        if (source.isEmpty()) {
            return List.of();
        }
        int draws = (int) Math.ceil(size * fraction);
        Set<String> selection = new LinkedHashSet<>();
        for (int i = 0; i < draws; i++) {
            selection.add(source.get(random.nextInt(source.size())).semanticId());
        }
        return new ArrayList<>(selection);
    }

    private List<String> sampleWithoutReplacement(List<StixEntity> source, int size, double fraction) {
        if (source.isEmpty()) {
            return List.of();
        }
        int draws = Math.min(source.size(), (int) Math.ceil(size * fraction));
        int[] order = MathArrays.natural(source.size());
        MathArrays.shuffle(order, random);
        List<String> selection = new ArrayList<>(draws);
        for (int i = 0; i < draws; i++) {
            selection.add(source.get(order[i]).semanticId());
        }
        return selection;
    }

    /**
     * Probability mass of a beta-binomial(n, alpha, beta) restricted to
     * {@code 0..n-1}, renormalized. Uses the pmf ratio
     * {@code p(k+1)/p(k) = (n-k)(k+alpha) / ((k+1)(n-k-1+beta))}.
     */
    static double[] betaBinomialPmf(int n, double alpha, double beta) {
        double[] weights = new double[n];
        weights[0] = 1.0;
        for (int k = 0; k < n - 1; k++) {
            weights[k + 1] = weights[k] * ((n - k) * (k + alpha)) / ((k + 1) * (n - k - 1 + beta));
        }
        return MathArrays.normalizeArray(weights, 1.0);
    }
}
