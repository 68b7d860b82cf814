package in.genescore.application.port.output;

import in.genescore.domain.model.ReferenceGene;
import in.genescore.domain.model.ReferenceSet;

import java.util.List;

public interface ReferenceGeneRepository {
    /**
     * Reference rows of one control set, one row per (symbol, source).
     */
    List<ReferenceGene> findReferenceGenes(ReferenceSet set);
}
