package in.genescore.domain.model;

/**
 * Curated reference gene with provenance. A symbol may appear once per source.
 */
public record ReferenceGene(
        String geneSymbol,
        String source,      // omim_usher | syscilia_scgs_v2 | literature_validated
        String confidence   // HIGH
) {
    public static final String HIGH = "HIGH";

    public ReferenceGene {
        if (geneSymbol == null || geneSymbol.isBlank()) {
            throw new IllegalArgumentException("Reference gene symbol cannot be blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Reference gene source cannot be blank");
        }
    }

    public static ReferenceGene high(String geneSymbol, String source) {
        return new ReferenceGene(geneSymbol, source, HIGH);
    }
}
