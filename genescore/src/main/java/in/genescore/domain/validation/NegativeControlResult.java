package in.genescore.domain.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Negative-control validation. {@code highTierCount} counts housekeeping genes whose
 * composite is at or above {@code highTierThreshold}.
 */
public record NegativeControlResult(
        PercentileValidationResult ranking,
        int highTierCount,
        double highTierThreshold,
        Map<String, Double> referenceLayerMeans
) {
    public NegativeControlResult {
        referenceLayerMeans = Collections.unmodifiableMap(new LinkedHashMap<>(referenceLayerMeans));
    }

    public boolean passed() {
        return ranking.validationPassed();
    }
}
