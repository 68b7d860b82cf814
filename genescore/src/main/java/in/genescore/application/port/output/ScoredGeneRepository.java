package in.genescore.application.port.output;

import in.genescore.domain.model.ScoredGeneSet;

public interface ScoredGeneRepository {
    /**
     * Replace the stored scored genes with this run's output.
     */
    void replaceAll(ScoredGeneSet scoredGenes);

    /**
     * Number of stored scored genes.
     */
    int count();
}
