package in.genescore.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.genescore.domain.model.ScoringWeights;

import java.util.List;
import java.util.Map;

/**
 * Configuration for one scoring and validation run.
 *
 * Loaded from scoring-config.json by ScoringConfigService.
 */
public record ScoringConfig(
    @JsonProperty("weights")
    Map<String, Double> weights,        // layer -> weight, must sum to 1.0

    @JsonProperty("positiveThreshold")
    double positiveThreshold,           // known genes: median percentile must be >= this

    @JsonProperty("negativeThreshold")
    double negativeThreshold,           // housekeeping genes: median percentile must be < this

    @JsonProperty("sensitivityDeltas")
    List<Double> sensitivityDeltas,     // weight shifts, e.g. -0.10, -0.05, 0.05, 0.10

    @JsonProperty("sensitivityTopN")
    int sensitivityTopN,                // genes compared per perturbation

    @JsonProperty("persistScoredGenes")
    boolean persistScoredGenes          // replace scored_genes table after aggregation
) {
    /**
     * Default configuration: default weights, standard thresholds and deltas.
     */
    public static ScoringConfig defaults() {
        return new ScoringConfig(
            ScoringWeights.defaults().weights(),
            0.75,
            0.50,
            List.of(-0.10, -0.05, 0.05, 0.10),
            100,
            true
        );
    }

    public ScoringConfig withWeights(ScoringWeights newWeights) {
        return new ScoringConfig(newWeights.weights(), positiveThreshold, negativeThreshold,
            sensitivityDeltas, sensitivityTopN, persistScoredGenes);
    }

    /**
     * @throws IllegalArgumentException if the weights break the sum or range invariant
     */
    public ScoringWeights toWeights() {
        return new ScoringWeights(weights);
    }

    /**
     * Validate configuration values.
     */
    @JsonIgnore
    public boolean isValid() {
        return validationError() == null;
    }

    /**
     * @return a description of the first invalid value, or null when valid
     */
    @JsonIgnore
    public String validationError() {
        if (weights == null || weights.isEmpty()) {
            return "weights are missing";
        }
        try {
            toWeights();
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
        if (!(positiveThreshold >= 0 && positiveThreshold <= 1)) {
            return "positiveThreshold must be in [0,1]";
        }
        if (!(negativeThreshold >= 0 && negativeThreshold <= 1)) {
            return "negativeThreshold must be in [0,1]";
        }
        if (sensitivityDeltas == null || sensitivityDeltas.isEmpty()) {
            return "sensitivityDeltas are missing";
        }
        for (Double delta : sensitivityDeltas) {
            if (delta == null || !Double.isFinite(delta) || Math.abs(delta) > 1.0) {
                return "sensitivity delta out of range: " + delta;
            }
        }
        if (sensitivityTopN < 1) {
            return "sensitivityTopN must be positive";
        }
        return null;
    }
}
