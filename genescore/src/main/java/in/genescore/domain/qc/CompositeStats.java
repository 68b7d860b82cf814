package in.genescore.domain.qc;

/**
 * Summary of the composite score column. Statistics are null when no gene has a composite.
 * Percentiles use linear interpolation between closest ranks.
 */
public record CompositeStats(
        int totalGenes,
        int scoredGenes,
        Double mean,
        Double median,
        Double std,     // sample standard deviation
        Double min,
        Double max,
        Double p10,
        Double p25,
        Double p50,
        Double p75,
        Double p90
) {
    public static CompositeStats empty(int totalGenes) {
        return new CompositeStats(totalGenes, 0, null, null, null, null, null, null, null, null, null, null);
    }
}
