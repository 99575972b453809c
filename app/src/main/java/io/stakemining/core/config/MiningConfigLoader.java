package io.stakemining.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads and writes {@link MiningConfig} as JSON. Fields missing from the file keep their
 * {@link MiningConfig#defaults()} value.
 */
public final class MiningConfigLoader {
    private static final Logger LOG = Logger.getLogger(MiningConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private MiningConfigLoader() {}

    public static MiningConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            return MiningConfig.defaults();
        }
        try {
            JsonNode file = JSON.readTree(path.toFile());
            if (file == null || file.isNull() || file.isMissingNode()) {
                return MiningConfig.defaults();
            }
            if (!file.isObject()) {
                throw new IllegalStateException("Mining config in " + path + " must be a JSON object");
            }
            ObjectNode merged = JSON.valueToTree(MiningConfig.defaults());
            merged.setAll((ObjectNode) file);
            MiningConfig config = JSON.treeToValue(merged, MiningConfig.class);
            LOG.info("Loaded mining config from " + path);
            return config;
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException invalid) {
                throw new IllegalStateException("Invalid mining config in " + path + ": " + invalid.getMessage(), e);
            }
            throw new IllegalStateException("Failed to parse mining config from " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read mining config from " + path, e);
        }
    }

    public static void save(Path path, MiningConfig config) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist mining config to " + path, e);
        }
    }
}
