package com.threatattribution.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads fixtures from {@code src/test/resources/data}.
 */
public final class TestData {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String AGGAH = "Aggah_intrusion-set--088d7359-97fb-591b-aeed-be46caf1027d";
    public static final String KIPPIS = "Kippis_intrusion-set--088d7359-2332-591b-aeed-be83caf1027d";
    public static final String UNC2891 = "UNC2891_intrusion-set--6520a731-fa8a-5232-ba9f-8e0bff785ad6";

    private TestData() {
    }

    public static String text(String name) {
        try (InputStream in = open(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String name) {
        try (InputStream in = open(name)) {
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The three example intrusion-set bundles. */
    public static List<JsonNode> intrusionSets() {
        List<JsonNode> bundles = new ArrayList<>();
        json("intrusion_sets_example.json").forEach(bundles::add);
        return bundles;
    }

    public static JsonNode incident() {
        return json("incident.json");
    }

    private static InputStream open(String name) {
        InputStream in = TestData.class.getResourceAsStream("/data/" + name);
        if (in == null) {
            throw new IllegalArgumentException("Missing fixture: " + name);
        }
        return in;
    }
}
