package com.threatattribution.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatattribution.engine.TestData;
import com.threatattribution.engine.config.AttributionProperties;
import com.threatattribution.engine.metrics.AttributionMetrics;
import com.threatattribution.engine.model.ModelArtifactLoader;
import com.threatattribution.engine.prediction.PredictionResult;
import com.threatattribution.engine.prediction.PredictionStatus;
import com.threatattribution.engine.stix.IncidentSerializer;
import com.threatattribution.engine.stix.IntrusionSetParser;
import com.threatattribution.engine.training.TrainingDataException;
import com.threatattribution.engine.training.TrainingOutcome;
import com.threatattribution.engine.version.DatabaseVersion;
import com.threatattribution.engine.version.ModelRegistry;
import com.threatattribution.engine.version.ModelVersionConflictException;
import com.threatattribution.engine.version.VersionIncrement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class AttributionServiceTest {

    @TempDir
    Path artifactDir;

    private SimpleMeterRegistry meterRegistry;
    private ModelRegistry registry;
    private AttributionProperties properties;
    private AttributionService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        AttributionMetrics metrics = new AttributionMetrics(meterRegistry);
        metrics.init();
        registry = new ModelRegistry();
        properties = new AttributionProperties();
        service = new AttributionService(registry, new IncidentSerializer(TestData.MAPPER), new IntrusionSetParser(),
                properties, metrics, DatabaseVersion.DEFAULT);
    }

    @Test
    void shouldReportMissingModelBeforeTraining() {
        PredictionResult result = service.attribute(TestData.incident());

        assertEquals(PredictionStatus.MODEL_UNAVAILABLE, result.status());
        assertEquals("(0, 0, 1)", result.dbVersion());
        assertEquals(DatabaseVersion.DEFAULT, service.currentVersion());
    }

    @Test
    void retrainShouldRegisterNewModel() {
        TrainingOutcome outcome = service.retrain(TestData.intrusionSets(), VersionIncrement.PATCH);

        assertEquals(new DatabaseVersion(0, 0, 2), outcome.newVersion());
        assertEquals(outcome.newVersion(), service.currentVersion());

        PredictionResult result = service.attribute(TestData.text("incident.json"));
        assertEquals(TestData.AGGAH, result.topLabel());
        assertEquals("(0, 0, 2)", result.dbVersion());
        assertEquals(1.0, meterRegistry.get("attribution.training.runs").counter().count());
    }

    @Test
    void successiveRetrainsShouldKeepBumping() {
        service.retrain(TestData.intrusionSets(), VersionIncrement.PATCH);
        service.retrain(TestData.intrusionSets(), VersionIncrement.MINOR);

        assertEquals(new DatabaseVersion(0, 1, 0), service.currentVersion());
    }

    @Test
    void failedRetrainShouldKeepCurrentModel() {
        service.retrain(TestData.intrusionSets(), VersionIncrement.PATCH);
        List<JsonNode> empty = List.of();

        assertThrows(TrainingDataException.class, () -> service.retrain(empty, VersionIncrement.PATCH));

        assertEquals(new DatabaseVersion(0, 0, 2), service.currentVersion());
        assertEquals(1.0, meterRegistry.get("attribution.training.failures").counter().count());
    }

    @Test
    void staleVersionShouldFailRegistrationCleanly() {
        ModelRegistry staleRegistry = new ModelRegistry() {
            @Override
            public Optional<DatabaseVersion> currentVersion() {
                return Optional.of(DatabaseVersion.DEFAULT);
            }
        };
        AttributionMetrics metrics = new AttributionMetrics(meterRegistry);
        metrics.init();
        AttributionService staleService = new AttributionService(staleRegistry,
                new IncidentSerializer(TestData.MAPPER), new IntrusionSetParser(), properties, metrics,
                DatabaseVersion.DEFAULT);
        staleService.retrain(TestData.intrusionSets(), VersionIncrement.PATCH);

        assertThrows(ModelVersionConflictException.class,
                () -> staleService.retrain(TestData.intrusionSets(), VersionIncrement.PATCH));

        assertEquals(new DatabaseVersion(0, 0, 2), staleRegistry.current().orElseThrow().version());
        assertEquals(1.0, meterRegistry.get("attribution.training.failures").counter().count());
    }

    @Test
    void concurrentRetrainsShouldBothRegister() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<TrainingOutcome> first = executor.submit(
                    () -> service.retrain(TestData.intrusionSets(), VersionIncrement.PATCH));
            Future<TrainingOutcome> second = executor.submit(
                    () -> service.retrain(TestData.intrusionSets(), VersionIncrement.PATCH));

            assertNotEquals(first.get().newVersion(), second.get().newVersion());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(new DatabaseVersion(0, 0, 3), service.currentVersion());
        assertEquals(0.0, meterRegistry.get("attribution.training.failures").counter().count());
    }

    @Test
    void bootstrapShouldLoadSavedArtifact() throws Exception {
        TrainingOutcome outcome = service.retrain(TestData.intrusionSets(), VersionIncrement.PATCH);
        ModelArtifactLoader loader = new ModelArtifactLoader(TestData.MAPPER);
        loader.save(artifactDir, outcome.model(), outcome.newVersion());

        ModelRegistry freshRegistry = new ModelRegistry();
        properties.getModel().setArtifactPath(artifactDir.toString());
        new ModelBootstrap(properties, loader, freshRegistry).loadDefaultModel();

        assertEquals(new DatabaseVersion(0, 0, 2), freshRegistry.currentVersion().orElseThrow());
    }

    @Test
    void bootstrapWithoutArtifactShouldLeaveRegistryEmpty() {
        ModelRegistry freshRegistry = new ModelRegistry();
        new ModelBootstrap(properties, new ModelArtifactLoader(TestData.MAPPER), freshRegistry).loadDefaultModel();

        properties.getModel().setArtifactPath(artifactDir.resolve("missing").toString());
        new ModelBootstrap(properties, new ModelArtifactLoader(TestData.MAPPER), freshRegistry).loadDefaultModel();

        assertTrue(freshRegistry.current().isEmpty());
    }
}
