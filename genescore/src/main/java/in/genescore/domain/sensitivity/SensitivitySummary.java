package in.genescore.domain.sensitivity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate over the perturbations with a defined rho. Undefined ones count only in
 * {@code totalPerturbations}.
 */
public record SensitivitySummary(
        Double minRho,
        Double maxRho,
        Double meanRho,
        int stableCount,
        int unstableCount,
        int totalPerturbations,
        boolean overallStable,
        String mostSensitiveLayer,
        String mostRobustLayer,
        Map<String, Double> layerMeanRho
) {
    public SensitivitySummary {
        layerMeanRho = Collections.unmodifiableMap(new LinkedHashMap<>(layerMeanRho));
    }

    public int undefinedCount() {
        return totalPerturbations - stableCount - unstableCount;
    }
}
