package in.genescore.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one aggregation for one gene.
 * Maps only hold present layers; a null {@code compositeScore} means no usable evidence.
 */
public record ScoredGene(
        String geneId,
        String geneSymbol,
        Map<String, Double> layerScores,
        Map<String, Double> layerContributions, // score x weight, present layers only
        int evidenceCount,
        Double compositeScore,
        QualityFlag qualityFlag
) {
    public ScoredGene {
        layerScores = Collections.unmodifiableMap(new LinkedHashMap<>(layerScores));
        layerContributions = Collections.unmodifiableMap(new LinkedHashMap<>(layerContributions));
        if (evidenceCount == 0 && compositeScore != null) {
            throw new IllegalArgumentException("Gene " + geneId + " has a composite score without evidence");
        }
    }

    public boolean isScored() {
        return compositeScore != null;
    }
}
