package com.threatattribution.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.threatattribution.engine.version.DatabaseVersion;
import com.threatattribution.engine.version.VersionedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads and writes a model artifact directory.
 *
 * <p>
 * An artifact directory holds two files:
 * </p>
 * <ul>
 * <li>the metadata file ({@code meta_data.json} by default) with
 * {@code db_version} and {@code time_metadata_created};</li>
 * <li>the model file ({@code model.json} by default), the Jackson form of a
 * {@link NaiveBayesAttributionModel}.</li>
 * </ul>
 *
 * <p>
 * Loading never fails loudly: a missing or unreadable artifact is logged and
 * reported as absent, which prediction turns into the model-unavailable
 * result.
 * </p>
 *
 * @author Naveed Gung
 */
public class ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    public static final String DEFAULT_MODEL_FILE_NAME = "model.json";
    public static final String DEFAULT_META_FILE_NAME = "meta_data.json";

    static final String DB_VERSION_FIELD = "db_version";
    static final String CREATED_FIELD = "time_metadata_created";

    private final ObjectMapper objectMapper;
    private final String modelFileName;
    private final String metaFileName;

    public ModelArtifactLoader(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_MODEL_FILE_NAME, DEFAULT_META_FILE_NAME);
    }

    public ModelArtifactLoader(ObjectMapper objectMapper, String modelFileName, String metaFileName) {
        this.objectMapper = objectMapper;
        this.modelFileName = modelFileName;
        this.metaFileName = metaFileName;
    }

    /**
     * Load the artifact stored in a directory.
     *
     * @param directory the artifact directory
     * @return the model with its version, or empty if it cannot be read
     */
    public Optional<VersionedModel> load(Path directory) {
        Path metaPath = directory.resolve(metaFileName);
        Path modelPath = directory.resolve(modelFileName);
        log.info("Loading attribution model from {}", directory);

        DatabaseVersion version;
        try {
            JsonNode meta = objectMapper.readTree(metaPath.toFile());
            version = DatabaseVersion.parse(meta.path(DB_VERSION_FIELD).asText(null));
            log.info("Model metadata: version={} created={}", version, meta.path(CREATED_FIELD).asText("unknown"));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Model metadata at {} cannot be loaded: {}", metaPath, e.getMessage());
            return Optional.empty();
        }

        try {
            NaiveBayesAttributionModel model = objectMapper.readValue(modelPath.toFile(),
                    NaiveBayesAttributionModel.class);
            log.info("Model loaded from {} with {} labels", modelPath, model.classes().size());
            return Optional.of(new VersionedModel(model, version, Instant.now()));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Model file at {} cannot be loaded: {}", modelPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Write a model artifact, creating the directory if needed.
     *
     * @param directory the artifact directory
     * @param model     the model to write
     * @param version   the database version to record
     * @throws IOException if either file cannot be written
     */
    public void save(Path directory, NaiveBayesAttributionModel model, DatabaseVersion version) throws IOException {
        Files.createDirectories(directory);

        ObjectNode meta = objectMapper.createObjectNode();
        meta.put(DB_VERSION_FIELD, version.toString());
        meta.put(CREATED_FIELD, Instant.now().toString());

        objectMapper.writeValue(directory.resolve(metaFileName).toFile(), meta);
        objectMapper.writeValue(directory.resolve(modelFileName).toFile(), model);
        log.info("Saved attribution model for version {} to {}", version, directory);
    }
}
