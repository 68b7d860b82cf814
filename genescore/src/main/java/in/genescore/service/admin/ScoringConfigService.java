package in.genescore.service.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.genescore.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Service for managing scoring configuration.
 *
 * Stores configuration in a JSON file. Defaults apply only when the file is absent;
 * a file that cannot be read fails construction.
 */
public final class ScoringConfigService {
    private static final Logger log = LoggerFactory.getLogger(ScoringConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONFIG_FILE = "scoring-config.json";

    private final Path configFilePath;
    private volatile ScoringConfig currentConfig;

    public ScoringConfigService(String configDir) {
        this.configFilePath = Paths.get(configDir, CONFIG_FILE);
        this.currentConfig = loadConfig();
    }

    /**
     * Get current configuration. Never null.
     */
    public ScoringConfig getConfig() {
        return currentConfig;
    }

    public Path getConfigFilePath() {
        return configFilePath;
    }

    /**
     * Update configuration and persist to disk.
     *
     * @throws IllegalArgumentException if config is invalid
     * @throws IOException if save fails
     */
    public void updateConfig(ScoringConfig newConfig) throws IOException {
        if (newConfig == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        String error = newConfig.validationError();
        if (error != null) {
            throw new IllegalArgumentException("Invalid scoring configuration: " + error);
        }

        saveConfig(newConfig);
        this.currentConfig = newConfig;

        log.info("✅ Scoring configuration updated: weights={}, topN={}, deltas={}",
            newConfig.weights(), newConfig.sensitivityTopN(), newConfig.sensitivityDeltas());
    }

    /**
     * @throws IllegalStateException if the file exists but cannot be read or parsed
     */
    private ScoringConfig loadConfig() {
        if (!Files.exists(configFilePath)) {
            log.info("No config file found, using defaults: {}", configFilePath);
            return ScoringConfig.defaults();
        }
        try {
            String json = Files.readString(configFilePath);
            ScoringConfig config = MAPPER.readValue(json, ScoringConfig.class);
            log.info("✅ Loaded scoring config from: {}", configFilePath);
            return config;
        } catch (IOException e) {
            log.error("❌ Failed to load config file {}: {}", configFilePath, e.getMessage());
            throw new IllegalStateException("Failed to load scoring config " + configFilePath, e);
        }
    }

    private void saveConfig(ScoringConfig config) throws IOException {
        File configDir = configFilePath.getParent().toFile();
        if (!configDir.exists()) {
            configDir.mkdirs();
        }

        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configFilePath, json);

        log.info("✅ Configuration saved to: {}", configFilePath);
    }
}
