package in.genescore.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable per-layer weight set.
 *
 * Invariants: every weight is finite and in [0,1], and the weights sum to 1.0
 * within {@link #SUM_TOLERANCE}. Instances are passed explicitly into every
 * aggregation call; there is no "current" weight set.
 */
public record ScoringWeights(Map<String, Double> weights) {

    public static final double SUM_TOLERANCE = 1e-6;

    public ScoringWeights {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("Scoring weights cannot be empty");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            Double w = e.getValue();
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new IllegalArgumentException("Layer name cannot be blank");
            }
            if (w == null || !Double.isFinite(w) || w < 0.0 || w > 1.0) {
                throw new IllegalArgumentException(
                        "Weight for layer '" + e.getKey() + "' must be in [0,1], got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(String.format(
                    "Scoring weights must sum to 1.0 (±%.0e), got %.8f", SUM_TOLERANCE, sum));
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    /**
     * Default weights of the six evidence layers.
     */
    public static ScoringWeights defaults() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("gnomad", 0.20);
        w.put("expression", 0.20);
        w.put("annotation", 0.15);
        w.put("localization", 0.15);
        w.put("animal_model", 0.15);
        w.put("literature", 0.15);
        return new ScoringWeights(w);
    }

    public static ScoringWeights uniform(List<String> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("At least one layer is required");
        }
        Map<String, Double> w = new LinkedHashMap<>();
        double each = 1.0 / layers.size();
        for (String layer : layers) {
            w.put(layer, each);
        }
        return new ScoringWeights(w);
    }

    /**
     * @throws IllegalArgumentException if the layer is not part of this weight set
     */
    public double weight(String layer) {
        Double w = weights.get(layer);
        if (w == null) {
            throw new IllegalArgumentException("Unknown evidence layer: " + layer);
        }
        return w;
    }

    public boolean hasLayer(String layer) {
        return weights.containsKey(layer);
    }

    public List<String> layers() {
        return List.copyOf(weights.keySet());
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Add {@code delta} to one layer, clamp it to [0,1] and renormalize every
     * weight so the set sums to 1.0 again. Falls back to uniform weights when
     * the clamped total is zero.
     *
     * @throws IllegalArgumentException for an unknown layer or non-finite delta
     */
    public ScoringWeights perturb(String layer, double delta) {
        if (!hasLayer(layer)) {
            throw new IllegalArgumentException("Unknown evidence layer: " + layer);
        }
        if (!Double.isFinite(delta)) {
            throw new IllegalArgumentException("Perturbation delta must be finite, got " + delta);
        }

        Map<String, Double> raw = new LinkedHashMap<>(weights);
        double adjusted = Math.max(0.0, Math.min(1.0, raw.get(layer) + delta));
        raw.put(layer, adjusted);

        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0.0) {
            return uniform(layers());
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        raw.forEach((k, v) -> normalized.put(k, v / total));
        return new ScoringWeights(normalized);
    }

    public boolean approximatelyEquals(ScoringWeights other, double tolerance) {
        if (other == null || !weights.keySet().equals(other.weights.keySet())) {
            return false;
        }
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            if (Math.abs(e.getValue() - other.weights.get(e.getKey())) > tolerance) {
                return false;
            }
        }
        return true;
    }
}
