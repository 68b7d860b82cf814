package in.genescore.domain.sensitivity;

import in.genescore.domain.model.ScoringWeights;

import java.util.List;

/**
 * All perturbations of one sensitivity run, in (layer, delta) order.
 */
public record SensitivityResult(
        ScoringWeights baselineWeights,
        List<SensitivityPerturbation> perturbations,
        List<Double> deltas,
        int topN,
        double stabilityThreshold
) {
    public SensitivityResult {
        perturbations = List.copyOf(perturbations);
        deltas = List.copyOf(deltas);
    }
}
