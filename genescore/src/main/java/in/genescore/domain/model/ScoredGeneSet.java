package in.genescore.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable result of one aggregation run, ordered by composite descending
 * (nulls last, then gene id ascending). A new run supersedes it.
 */
public record ScoredGeneSet(
        List<ScoredGene> genes,
        ScoringWeights weights,
        List<EvidenceLayer> layers,
        Instant scoredAt
) {
    public ScoredGeneSet {
        genes = List.copyOf(genes);
        layers = List.copyOf(layers);
    }

    public int size() {
        return genes.size();
    }

    /**
     * Genes with a non-null composite, in ranking order.
     */
    public List<ScoredGene> ranked() {
        return genes.stream().filter(ScoredGene::isScored).toList();
    }

    public List<ScoredGene> topN(int n) {
        return ranked().stream().limit(Math.max(0, n)).toList();
    }

    public int scoredCount() {
        return (int) genes.stream().filter(ScoredGene::isScored).count();
    }

    public List<String> layerNames() {
        return EvidenceLayer.names(layers);
    }
}
