package in.genescore.domain.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Recall of unique reference symbols in the top-k of the ranking.
 *
 * The denominator is the number of unique reference symbols that have a composite
 * in the scored set; {@code totalReferenceUnique} is reported alongside it. Both maps
 * are empty when that denominator is zero.
 */
public record RecallAtK(
        SortedMap<Integer, Double> absolute,   // k -> recall
        Map<String, Double> percentage,        // "5%" -> recall
        int totalReferenceUnique,
        int totalReferenceInDataset,
        int totalScored
) {
    public RecallAtK {
        absolute = Collections.unmodifiableSortedMap(new TreeMap<>(absolute));
        percentage = Collections.unmodifiableMap(new LinkedHashMap<>(percentage));
    }
}
