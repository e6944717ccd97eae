package com.threatattribution.engine.version;

import com.threatattribution.engine.model.NaiveBayesAttributionModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    private ModelRegistry registry;
    private NaiveBayesAttributionModel model;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry();
        model = NaiveBayesAttributionModel.fit(List.of("malware-a", "tool-b"), List.of("x", "y"), 1.0);
    }

    @Test
    void shouldStartEmpty() {
        assertTrue(registry.current().isEmpty());
        assertTrue(registry.currentVersion().isEmpty());
        assertFalse(registry.isCompatible(DatabaseVersion.DEFAULT));
    }

    @Test
    void shouldExposeRegisteredModel() {
        registry.register(VersionedModel.of(model, new DatabaseVersion(0, 0, 2)));

        assertSame(model, registry.current().orElseThrow().model());
        assertTrue(registry.isCompatible(new DatabaseVersion(0, 0, 2)));
        assertFalse(registry.isCompatible(DatabaseVersion.DEFAULT));
    }

    @Test
    void shouldOnlyMoveForward() {
        registry.register(VersionedModel.of(model, new DatabaseVersion(0, 1, 0)));

        assertThrows(IllegalStateException.class,
                () -> registry.register(VersionedModel.of(model, new DatabaseVersion(0, 1, 0))));
        assertThrows(IllegalStateException.class,
                () -> registry.register(VersionedModel.of(model, new DatabaseVersion(0, 0, 9))));
        assertEquals(new DatabaseVersion(0, 1, 0), registry.currentVersion().orElseThrow());

        registry.register(VersionedModel.of(model, new DatabaseVersion(0, 1, 1)));
        assertEquals(new DatabaseVersion(0, 1, 1), registry.currentVersion().orElseThrow());
    }
}
