package de.bsommerfeld.swiftview.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link EngineConfig} from a JSON file. A missing file is created with
 * the defaults so users have something to edit; unknown keys are ignored so
 * older files keep loading after new knobs are added.
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private EngineConfigLoader() {
    }

    /**
     * @throws UncheckedIOException if the file exists but cannot be parsed,
     *                              or the defaults cannot be written
     */
    public static EngineConfig load(Path configFile) {
        try {
            if (Files.exists(configFile)) {
                LOG.info("Loading engine configuration from: {}", configFile.toAbsolutePath());
                EngineConfig config = MAPPER.readValue(configFile.toFile(), EngineConfig.class);
                validate(config);
                return config;
            }

            EngineConfig defaults = new EngineConfig();
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            MAPPER.writeValue(configFile.toFile(), defaults);
            LOG.info("No engine configuration found, wrote defaults to: {}", configFile.toAbsolutePath());
            return defaults;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load engine configuration: " + configFile, e);
        }
    }

    public static void save(EngineConfig config, Path configFile) {
        try {
            MAPPER.writeValue(configFile.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save engine configuration: " + configFile, e);
        }
    }

    private static void validate(EngineConfig config) {
        if (config.getThumbnailWidth() <= 0 || config.getThumbnailHeight() <= 0)
            throw new IllegalArgumentException("Thumbnail size must be positive: "
                    + config.getThumbnailWidth() + "x" + config.getThumbnailHeight());
        if (config.getDecodeWorkers() <= 0 || config.getIoThreads() <= 0)
            throw new IllegalArgumentException("Pool sizes must be positive");
        if (config.getPumpBatchSize() <= 0)
            throw new IllegalArgumentException("pumpBatchSize must be positive");
        if (config.getScanChunkSize() <= 0)
            throw new IllegalArgumentException("scanChunkSize must be positive");
        if (config.getWriteRetries() < 0)
            throw new IllegalArgumentException("writeRetries must not be negative");
    }
}
