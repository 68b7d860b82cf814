package in.genescore.bootstrap;

import in.genescore.config.ScoringConfig;
import in.genescore.domain.model.EvidenceLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before any database access. Throws IllegalStateException if the scoring
 * configuration cannot be used with the configured evidence layers.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(ScoringConfig config, List<EvidenceLayer> layers) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (config == null) {
            throw new IllegalStateException("Scoring configuration is missing");
        }

        String error = config.validationError();
        if (error != null) {
            log.error("❌ Invalid scoring configuration: {}", error);
            throw new IllegalStateException("Invalid scoring configuration: " + error);
        }

        Set<String> expected = new HashSet<>(EvidenceLayer.names(layers));
        Set<String> configured = config.weights().keySet();
        if (!expected.equals(configured)) {
            Set<String> missing = new HashSet<>(expected);
            missing.removeAll(configured);
            Set<String> unknown = new HashSet<>(configured);
            unknown.removeAll(expected);
            log.error("❌ Weight layers do not match evidence layers: missing={}, unknown={}", missing, unknown);
            throw new IllegalStateException(
                "Weight layers do not match evidence layers: missing=" + missing + ", unknown=" + unknown);
        }

        log.info("Weights: {}", config.weights());
        log.info("Thresholds: positive >= {}, negative < {}", config.positiveThreshold(), config.negativeThreshold());
        log.info("Sensitivity: deltas={}, topN={}", config.sensitivityDeltas(), config.sensitivityTopN());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
