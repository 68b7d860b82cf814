package in.genescore.domain.model;

/**
 * One row of the gene universe.
 */
public record GeneIdentity(
        String geneId,      // Ensembl gene id
        String geneSymbol   // HGNC symbol, may be null for unmapped ids
) {
    public GeneIdentity {
        if (geneId == null || geneId.isBlank()) {
            throw new IllegalArgumentException("Gene id cannot be blank");
        }
    }
}
