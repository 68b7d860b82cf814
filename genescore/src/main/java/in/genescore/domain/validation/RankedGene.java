package in.genescore.domain.validation;

/**
 * A reference gene located in the ranking. {@code percentileRank} is 0 for the lowest
 * composite and 1 for the highest.
 */
public record RankedGene(
        String geneSymbol,
        double compositeScore,
        double percentileRank,
        String source
) {
}
