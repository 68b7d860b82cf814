package in.genescore.domain.validation;

/**
 * Positive-control metrics restricted to one provenance source.
 */
public record SourceBreakdown(
        String source,
        int count,
        Double medianPercentile,   // null when no gene of this source was found
        int topQuartileCount
) {
}
