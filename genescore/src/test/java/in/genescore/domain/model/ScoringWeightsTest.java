package in.genescore.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Scoring Weights Tests")
class ScoringWeightsTest {

    @Test
    @DisplayName("Default weights cover six layers and sum to 1.0")
    void defaultsSumToOne() {
        ScoringWeights weights = ScoringWeights.defaults();

        assertEquals(List.of("gnomad", "expression", "annotation", "localization", "animal_model", "literature"),
            weights.layers());
        assertEquals(1.0, weights.sum(), ScoringWeights.SUM_TOLERANCE);
        assertEquals(0.20, weights.weight("gnomad"));
        assertEquals(0.15, weights.weight("literature"));
    }

    @Test
    @DisplayName("Weights not summing to 1.0 are rejected")
    void rejectsBadSum() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("a", 0.5);
        w.put("b", 0.4);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(w));
        assertTrue(e.getMessage().contains("sum to 1.0"));
    }

    @Test
    @DisplayName("Sum within tolerance is accepted")
    void acceptsSumWithinTolerance() {
        assertDoesNotThrow(() -> new ScoringWeights(Map.of("a", 0.5, "b", 0.5000005)));
    }

    @Test
    @DisplayName("Out-of-range and non-finite weights are rejected")
    void rejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(Map.of("a", -0.1, "b", 1.1)));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(Map.of("a", Double.NaN, "b", 1.0)));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(Map.of()));
    }

    @Test
    @DisplayName("Weight map cannot be modified")
    void immutable() {
        ScoringWeights weights = ScoringWeights.defaults();
        assertThrows(UnsupportedOperationException.class, () -> weights.weights().put("gnomad", 0.5));
    }

    @Test
    @DisplayName("Every perturbation keeps the sum invariant")
    void perturbationKeepsSum() {
        ScoringWeights baseline = ScoringWeights.defaults();
        for (String layer : baseline.layers()) {
            for (double delta : new double[]{-1.0, -0.5, -0.10, -0.05, 0.05, 0.10, 0.5, 1.0}) {
                ScoringWeights perturbed = baseline.perturb(layer, delta);
                assertEquals(1.0, perturbed.sum(), ScoringWeights.SUM_TOLERANCE, layer + " " + delta);
                perturbed.weights().values().forEach(w -> assertTrue(w >= 0.0 && w <= 1.0));
            }
        }
    }

    @Test
    @DisplayName("Zero delta returns the baseline weights")
    void zeroDeltaIsIdempotent() {
        ScoringWeights baseline = ScoringWeights.defaults();
        for (String layer : baseline.layers()) {
            assertTrue(baseline.perturb(layer, 0.0).approximatelyEquals(baseline, 1e-12));
        }
    }

    @Test
    @DisplayName("Perturbation clamps to [0,1] then renormalizes")
    void perturbClampsAndRenormalizes() {
        ScoringWeights baseline = new ScoringWeights(Map.of("a", 0.95, "b", 0.05));

        ScoringWeights perturbed = baseline.perturb("a", 0.10);

        assertEquals(1.0 / 1.05, perturbed.weight("a"), 1e-12);
        assertEquals(0.05 / 1.05, perturbed.weight("b"), 1e-12);
    }

    @Test
    @DisplayName("Renormalization increases the relative share of the perturbed layer")
    void perturbShiftsEmphasis() {
        ScoringWeights baseline = ScoringWeights.defaults();

        ScoringWeights perturbed = baseline.perturb("literature", 0.10);

        assertEquals(0.25 / 1.10, perturbed.weight("literature"), 1e-12);
        assertEquals(0.20 / 1.10, perturbed.weight("gnomad"), 1e-12);
    }

    @Test
    @DisplayName("All-zero perturbation falls back to uniform weights")
    void uniformFallback() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("a", 1.0);
        w.put("b", 0.0);
        ScoringWeights baseline = new ScoringWeights(w);

        ScoringWeights perturbed = baseline.perturb("a", -1.0);

        assertEquals(0.5, perturbed.weight("a"), 1e-12);
        assertEquals(0.5, perturbed.weight("b"), 1e-12);
    }

    @Test
    @DisplayName("Unknown layer is a configuration error")
    void unknownLayer() {
        ScoringWeights baseline = ScoringWeights.defaults();

        assertThrows(IllegalArgumentException.class, () -> baseline.perturb("proteomics", 0.05));
        assertThrows(IllegalArgumentException.class, () -> baseline.weight("proteomics"));
    }

    @Test
    @DisplayName("Uniform weights split evenly")
    void uniform() {
        ScoringWeights weights = ScoringWeights.uniform(List.of("a", "b", "c", "d"));

        assertEquals(0.25, weights.weight("c"), 1e-12);
        assertEquals(1.0, weights.sum(), ScoringWeights.SUM_TOLERANCE);
    }
}
