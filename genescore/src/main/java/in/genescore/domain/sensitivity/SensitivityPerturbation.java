package in.genescore.domain.sensitivity;

import in.genescore.domain.model.ScoringWeights;

/**
 * One (layer, delta) perturbation compared to the baseline ranking.
 * {@code spearmanRho} is null when the top-N overlap is too small.
 */
public record SensitivityPerturbation(
        String layer,
        double delta,
        ScoringWeights perturbedWeights,
        Double spearmanRho,
        Double spearmanPValue,
        int overlapCount,
        int topN,
        double stabilityThreshold
) {
    /**
     * @return null when rho is undefined
     */
    public Boolean stable() {
        return spearmanRho == null ? null : spearmanRho >= stabilityThreshold;
    }
}
