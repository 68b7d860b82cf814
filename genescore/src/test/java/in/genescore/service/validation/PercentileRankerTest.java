package in.genescore.service.validation;

import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.service.scoring.CompositeScoreAggregator;
import in.genescore.testsupport.InMemoryEvidenceRepository;
import in.genescore.testsupport.TestLayers;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PercentileRankerTest {

    private static ScoredGeneSet score(InMemoryEvidenceRepository repo) {
        return new CompositeScoreAggregator(repo, TestLayers.layers("l1")).aggregate(TestLayers.weights("l1", 1.0));
    }

    @Test
    void tiesShareTheLowestRank() {
        InMemoryEvidenceRepository repo = new InMemoryEvidenceRepository()
            .gene("G1", "TOP", Map.of("l1", 0.9))
            .gene("G2", "TIE_A", Map.of("l1", 0.5))
            .gene("G3", "TIE_B", Map.of("l1", 0.5))
            .gene("G4", "LOW", Map.of("l1", 0.1))
            .gene("G5", "NONE", Map.of());

        Map<String, PercentileRanker.Entry> ranks = PercentileRanker.rankBySymbol(score(repo));

        assertEquals(1.0, ranks.get("TOP").percentile(), 1e-12);
        assertEquals(1.0 / 3, ranks.get("TIE_A").percentile(), 1e-12);
        assertEquals(1.0 / 3, ranks.get("TIE_B").percentile(), 1e-12);
        assertEquals(0.0, ranks.get("LOW").percentile(), 1e-12);
        assertFalse(ranks.containsKey("NONE"));
    }

    @Test
    void singleScoredGeneIsZero() {
        InMemoryEvidenceRepository repo = new InMemoryEvidenceRepository()
            .gene("G1", "ONLY", Map.of("l1", 0.7));

        assertEquals(0.0, PercentileRanker.rankBySymbol(score(repo)).get("ONLY").percentile());
    }

    @Test
    void duplicateSymbolKeepsHighestRankedGene() {
        InMemoryEvidenceRepository repo = new InMemoryEvidenceRepository()
            .gene("G1", "DUP", Map.of("l1", 0.2))
            .gene("G2", "DUP", Map.of("l1", 0.8))
            .gene("G3", "OTHER", Map.of("l1", 0.5));

        PercentileRanker.Entry entry = PercentileRanker.rankBySymbol(score(repo)).get("DUP");

        assertEquals("G2", entry.gene().geneId());
        assertEquals(1.0, entry.percentile(), 1e-12);
    }
}
