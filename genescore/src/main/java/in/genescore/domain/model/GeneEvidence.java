package in.genescore.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Left-joined evidence for one gene. Layers without a score are absent from
 * {@code presentScores}; absence is never stored as 0.
 */
public record GeneEvidence(
        String geneId,
        String geneSymbol,
        Map<String, Double> presentScores
) {
    public GeneEvidence {
        presentScores = presentScores == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(presentScores));
    }

    /**
     * @return the layer score, or null when the layer has no evidence for this gene
     */
    public Double score(String layer) {
        return presentScores.get(layer);
    }

    public boolean hasScore(String layer) {
        return presentScores.containsKey(layer);
    }

    public int evidenceCount() {
        return presentScores.size();
    }
}
