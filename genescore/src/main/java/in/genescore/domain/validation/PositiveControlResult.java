package in.genescore.domain.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Positive-control validation with recall and per-source breakdown.
 * {@code referenceLayerMeans} is the mean present score per layer over matched genes.
 */
public record PositiveControlResult(
        PercentileValidationResult ranking,
        RecallAtK recallAtK,
        Map<String, SourceBreakdown> perSource,
        Map<String, Double> referenceLayerMeans
) {
    public PositiveControlResult {
        perSource = Collections.unmodifiableMap(new LinkedHashMap<>(perSource));
        referenceLayerMeans = Collections.unmodifiableMap(new LinkedHashMap<>(referenceLayerMeans));
    }

    public boolean passed() {
        return ranking.validationPassed();
    }
}
