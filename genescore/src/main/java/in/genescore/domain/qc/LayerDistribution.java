package in.genescore.domain.qc;

/**
 * Distribution of present scores for one layer. Standard deviation is the population one.
 */
public record LayerDistribution(
        String layer,
        long count,
        double mean,
        double median,
        double std,
        double min,
        double max
) {
    public boolean withinUnitInterval() {
        return min >= 0.0 && max <= 1.0;
    }
}
