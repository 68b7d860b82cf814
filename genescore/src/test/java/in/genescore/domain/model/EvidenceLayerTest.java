package in.genescore.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceLayerTest {

    @Test
    void defaultLayersMatchDefaultWeights() {
        assertEquals(ScoringWeights.defaults().layers(), EvidenceLayer.names(EvidenceLayer.DEFAULT_LAYERS));
    }

    @Test
    void keyColumnDefaultsToGeneId() {
        EvidenceLayer layer = EvidenceLayer.of("protein", "protein_features", "protein_score_normalized");

        assertEquals("gene_id", layer.keyColumn());
        assertEquals("protein_features", layer.table());
    }

    @Test
    void rejectsNonIdentifiers() {
        assertThrows(IllegalArgumentException.class,
            () -> EvidenceLayer.of("gnomad", "gnomad_constraint; DROP TABLE x", "loeuf_normalized"));
        assertThrows(IllegalArgumentException.class,
            () -> EvidenceLayer.of("gnomad", "gnomad_constraint", "1score"));
        assertThrows(IllegalArgumentException.class,
            () -> new EvidenceLayer("gnomad", "gnomad_constraint", null, "loeuf_normalized"));
    }

    @Test
    void namesPreserveOrder() {
        List<EvidenceLayer> layers = List.of(
            EvidenceLayer.of("b", "t_b", "s"),
            EvidenceLayer.of("a", "t_a", "s"));

        assertEquals(List.of("b", "a"), EvidenceLayer.names(layers));
    }
}
