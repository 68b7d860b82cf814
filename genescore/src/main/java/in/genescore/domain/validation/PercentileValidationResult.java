package in.genescore.domain.validation;

import java.util.List;

/**
 * Where one reference set falls in the composite ranking.
 *
 * When no reference gene is found, {@code validationPassed} is false,
 * {@code medianPercentile} is null and {@code reason} names the failure.
 */
public record PercentileValidationResult(
        int expectedCount,          // unique reference symbols
        int foundCount,             // reference rows matched to a scored gene
        Double medianPercentile,
        int topQuartileCount,
        double topQuartileFraction,
        double threshold,
        boolean validationPassed,
        List<RankedGene> geneDetails,
        String reason
) {
    public static final String NO_KNOWN_GENES_FOUND = "no_known_genes_found";
    public static final String NO_HOUSEKEEPING_GENES_FOUND = "no_housekeeping_genes_found";
    public static final String MEDIAN_BELOW_THRESHOLD = "median_percentile_below_threshold";
    public static final String MEDIAN_NOT_BELOW_THRESHOLD = "median_percentile_not_below_threshold";

    public PercentileValidationResult {
        geneDetails = List.copyOf(geneDetails);
    }

    public static PercentileValidationResult notFound(int expectedCount, double threshold, String reason) {
        return new PercentileValidationResult(expectedCount, 0, null, 0, 0.0, threshold, false, List.of(), reason);
    }
}
