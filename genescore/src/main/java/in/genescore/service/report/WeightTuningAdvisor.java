package in.genescore.service.report;

import in.genescore.domain.sensitivity.SensitivitySummary;
import in.genescore.domain.validation.NegativeControlResult;
import in.genescore.domain.validation.PositiveControlResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Weight tuning guidance derived from validation outcomes.
 *
 * Suggestions are guidance only; weights are never changed here. Whenever a suggestion
 * is made the circular-validation disclosure is appended.
 */
public final class WeightTuningAdvisor {

    static final int LAYERS_TO_NAME = 2;

    public static final String CIRCULAR_VALIDATION_WARNING =
        "Any weight tuning based on these validation results is post-validation tuning and introduces "
            + "circular validation risk: the same positive and negative controls cannot be used to validate "
            + "weights they were used to select.";

    public static final String HOLD_OUT_REQUIREMENT =
        "Tuned weights must be re-validated against an independent hold-out reference set "
            + "before they are trusted.";

    /**
     * @return recommendation lines; a single "no tuning" line when every prong passed
     */
    public List<String> recommend(PositiveControlResult positive,
                                  NegativeControlResult negative,
                                  SensitivitySummary sensitivity) {
        List<String> out = new ArrayList<>();
        boolean posPassed = positive.passed();
        boolean negPassed = negative.passed();
        boolean sensStable = sensitivity.overallStable();

        if (posPassed && negPassed && sensStable) {
            out.add("Current weights are validated. No tuning recommended.");
            return out;
        }

        if (!posPassed) {
            List<String> strong = highestLayers(positive.referenceLayerMeans());
            out.add("Known genes rank below the expected threshold: review the per-source breakdown to find "
                + "which reference collection validates poorly.");
            if (!strong.isEmpty()) {
                out.add("Consider increasing the weight of layers where known genes score consistently high: "
                    + String.join(", ", strong) + ".");
            } else {
                out.add("Consider increasing the weight of layers where known genes score consistently high.");
            }
        }

        if (!negPassed) {
            List<String> boosting = highestLayers(negative.referenceLayerMeans());
            if (!boosting.isEmpty()) {
                out.add("Housekeeping genes rank higher than expected: examine the layers boosting them ("
                    + String.join(", ", boosting) + ") and consider reducing their weight.");
            } else {
                out.add("Housekeeping genes rank higher than expected: examine which layers boost them "
                    + "and consider reducing their weight.");
            }
        }

        if (!sensStable) {
            if (sensitivity.mostSensitiveLayer() != null) {
                out.add("Rankings are unstable (" + sensitivity.unstableCount() + " unstable perturbations): "
                    + "consider reducing the weight of the most sensitive layer, "
                    + sensitivity.mostSensitiveLayer() + ".");
            } else {
                out.add("Ranking stability could not be established: no perturbation had enough top-N overlap "
                    + "to compute a correlation.");
            }
        }

        out.add(CIRCULAR_VALIDATION_WARNING);
        out.add(HOLD_OUT_REQUIREMENT);
        return out;
    }

    private static List<String> highestLayers(Map<String, Double> layerMeans) {
        return layerMeans.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(LAYERS_TO_NAME)
            .map(Map.Entry::getKey)
            .toList();
    }
}
