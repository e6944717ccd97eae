package com.threatattribution.engine.metrics;

import com.threatattribution.engine.prediction.PredictionResult;
import com.threatattribution.engine.prediction.PredictionStatus;
import com.threatattribution.engine.training.TrainingOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Exposes attribution metrics via Micrometer.
 *
 * <ul>
 * <li>{@code attribution.prediction.results} - predictions, tagged by
 * status</li>
 * <li>{@code attribution.prediction.latency} - time to serialize and score one
 * incident</li>
 * <li>{@code attribution.training.runs} / {@code attribution.training.failures}
 * - retraining attempts</li>
 * <li>{@code attribution.model.f1} - validation F1 of the last trained
 * model</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class AttributionMetrics {

    private static final Logger log = LoggerFactory.getLogger(AttributionMetrics.class);

    private final MeterRegistry meterRegistry;

    private final Map<PredictionStatus, Counter> predictionResults = new EnumMap<>(PredictionStatus.class);
    private final AtomicLong lastF1Bits = new AtomicLong(Double.doubleToLongBits(Double.NaN));
    private Timer predictionLatency;
    private Counter trainingRuns;
    private Counter trainingFailures;

    public AttributionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        for (PredictionStatus status : PredictionStatus.values()) {
            predictionResults.put(status, Counter.builder("attribution.prediction.results")
                    .description("Predictions by outcome")
                    .tag("status", status.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        predictionLatency = Timer.builder("attribution.prediction.latency")
                .description("Time to serialize and score one incident")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        trainingRuns = Counter.builder("attribution.training.runs")
                .description("Successful retraining runs")
                .register(meterRegistry);
        trainingFailures = Counter.builder("attribution.training.failures")
                .description("Failed retraining runs")
                .register(meterRegistry);
        Gauge.builder("attribution.model.f1", lastF1Bits, bits -> Double.longBitsToDouble(bits.get()))
                .description("Validation F1 of the last trained model")
                .register(meterRegistry);

        log.info("Attribution metrics registered");
    }

    /**
     * Time a prediction and count its outcome.
     *
     * @param prediction the prediction to run
     * @return the prediction result
     */
    public PredictionResult recordPrediction(Supplier<PredictionResult> prediction) {
        Timer.Sample sample = Timer.start(meterRegistry);
        PredictionResult result;
        try {
            result = prediction.get();
        } finally {
            sample.stop(predictionLatency);
        }
        predictionResults.get(result.status()).increment();
        return result;
    }

    public void recordTraining(TrainingOutcome outcome) {
        trainingRuns.increment();
        lastF1Bits.set(Double.doubleToLongBits(outcome.f1Score()));
    }

    public void recordTrainingFailure() {
        trainingFailures.increment();
    }
}
