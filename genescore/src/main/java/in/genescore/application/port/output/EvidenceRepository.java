package in.genescore.application.port.output;

import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.GeneIdentity;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the evidence store.
 */
public interface EvidenceRepository {
    /**
     * All genes that must appear in a scoring run, ordered by gene id.
     */
    List<GeneIdentity> findGeneUniverse();

    /**
     * Present scores of one layer for the given genes.
     * Genes without a score (or with a NULL score) are absent from the result.
     */
    Map<String, Double> findLayerScores(EvidenceLayer layer, Collection<String> geneIds);
}
