package in.genescore.application.service;

import in.genescore.application.port.output.ScoredGeneRepository;
import in.genescore.config.ScoringConfig;
import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.model.ScoringWeights;
import in.genescore.domain.report.OverallVerdict;
import in.genescore.domain.validation.PercentileValidationResult;
import in.genescore.infrastructure.reference.CuratedReferenceGeneRepository;
import in.genescore.service.qc.QualityControlAnalyzer;
import in.genescore.service.report.ValidationReportSynthesizer;
import in.genescore.service.scoring.CompositeScoreAggregator;
import in.genescore.service.sensitivity.SensitivityAnalyzer;
import in.genescore.service.validation.ControlValidator;
import in.genescore.testsupport.InMemoryEvidenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Scoring Pipeline Tests")
class ScoringPipelineTest {

    private static final List<String> LAYERS = EvidenceLayer.names(EvidenceLayer.DEFAULT_LAYERS);

    private ScoredGeneRepository scoredGeneRepository;

    @BeforeEach
    void setUp() {
        scoredGeneRepository = mock(ScoredGeneRepository.class);
    }

    @Test
    @DisplayName("Well-separated controls pass every prong and persist the scored set")
    void endToEndAllPassed() {
        PipelineOutcome outcome = pipeline(wellSeparatedUniverse(true)).run(ScoringConfig.defaults());

        assertEquals(306, outcome.scoredGenes().size());
        assertEquals(301, outcome.scoredGenes().scoredCount());
        assertTrue(outcome.qcReport().passed());

        assertTrue(outcome.positiveControls().passed());
        assertEquals(38, outcome.positiveControls().ranking().foundCount());
        assertTrue(outcome.negativeControls().passed());
        assertEquals(0, outcome.negativeControls().highTierCount());

        assertEquals(LAYERS.size() * 4, outcome.sensitivity().perturbations().size());
        assertTrue(outcome.sensitivitySummary().overallStable());

        assertEquals(OverallVerdict.ALL_PASSED, outcome.report().verdict());
        assertFalse(outcome.report().tuningRecommended());
        verify(scoredGeneRepository, times(1)).replaceAll(any(ScoredGeneSet.class));
    }

    @Test
    @DisplayName("Sensitivity reuses the baseline aggregation")
    void baselineAggregatedOnce() {
        InMemoryEvidenceRepository evidence = wellSeparatedUniverse(true);
        ScoringConfig config = ScoringConfig.defaults();

        pipeline(evidence).run(config);

        int perturbations = EvidenceLayer.DEFAULT_LAYERS.size() * config.sensitivityDeltas().size();
        assertEquals(1 + perturbations, evidence.universeQueries());
    }

    @Test
    @DisplayName("Persistence is skipped when disabled")
    void persistenceDisabled() {
        ScoringConfig d = ScoringConfig.defaults();
        ScoringConfig config = new ScoringConfig(d.weights(), d.positiveThreshold(), d.negativeThreshold(),
            d.sensitivityDeltas(), d.sensitivityTopN(), false);

        pipeline(wellSeparatedUniverse(true)).run(config);

        verifyNoInteractions(scoredGeneRepository);
    }

    @Test
    @DisplayName("Pipeline runs without a scored gene repository")
    void noScoredGeneRepository() {
        InMemoryEvidenceRepository evidence = wellSeparatedUniverse(true);
        CompositeScoreAggregator aggregator = new CompositeScoreAggregator(evidence);
        ScoringPipeline pipeline = new ScoringPipeline(aggregator, new QualityControlAnalyzer(),
            new ControlValidator(new CuratedReferenceGeneRepository()), new SensitivityAnalyzer(aggregator),
            new ValidationReportSynthesizer(), null);

        PipelineOutcome outcome = pipeline.run(ScoringWeights.defaults());

        assertEquals(OverallVerdict.ALL_PASSED, outcome.report().verdict());
    }

    @Test
    @DisplayName("Invalid weights are rejected before any evidence is read")
    void invalidConfigRejected() {
        InMemoryEvidenceRepository evidence = wellSeparatedUniverse(true);
        ScoringConfig d = ScoringConfig.defaults();
        ScoringConfig config = new ScoringConfig(Map.of("gwas", 0.5), d.positiveThreshold(), d.negativeThreshold(),
            d.sensitivityDeltas(), d.sensitivityTopN(), true);

        assertThrows(IllegalArgumentException.class, () -> pipeline(evidence).run(config));
        assertEquals(0, evidence.universeQueries());
        verifyNoInteractions(scoredGeneRepository);
    }

    @Test
    @DisplayName("Known genes without evidence fail validation as a normal outcome")
    void knownGenesWithoutEvidence() {
        PipelineOutcome outcome = pipeline(wellSeparatedUniverse(false)).run(ScoringConfig.defaults());

        assertFalse(outcome.positiveControls().passed());
        assertEquals(PercentileValidationResult.NO_KNOWN_GENES_FOUND, outcome.positiveControls().ranking().reason());
        assertEquals(OverallVerdict.FAILED, outcome.report().verdict());
        assertTrue(outcome.report().markdown().contains("### CRITICAL: Circular Validation Risk"));
    }

    private ScoringPipeline pipeline(InMemoryEvidenceRepository evidence) {
        CompositeScoreAggregator aggregator = new CompositeScoreAggregator(evidence);
        return new ScoringPipeline(
            aggregator,
            new QualityControlAnalyzer(),
            new ControlValidator(new CuratedReferenceGeneRepository()),
            new SensitivityAnalyzer(aggregator),
            new ValidationReportSynthesizer(),
            scoredGeneRepository);
    }

    /**
     * Known genes near the top, housekeeping genes near the bottom, 250 fillers in between
     * and five genes with no evidence at all.
     */
    private static InMemoryEvidenceRepository wellSeparatedUniverse(boolean knownGenesHaveEvidence) {
        InMemoryEvidenceRepository repo = new InMemoryEvidenceRepository();

        List<String> known = new ArrayList<>(CuratedReferenceGeneRepository.OMIM_USHER_GENES);
        known.addAll(CuratedReferenceGeneRepository.SYSCILIA_SCGS_V2_CORE);
        for (int i = 0; i < known.size(); i++) {
            String id = String.format("ENSGK%05d", i);
            if (knownGenesHaveEvidence) {
                repo.uniformGene(id, known.get(i), LAYERS, 0.90 + i * 0.001);
            } else {
                repo.gene(id, known.get(i), Map.of());
            }
        }

        List<String> housekeeping = CuratedReferenceGeneRepository.HOUSEKEEPING_GENES;
        for (int i = 0; i < housekeeping.size(); i++) {
            repo.uniformGene(String.format("ENSGH%05d", i), housekeeping.get(i), LAYERS, 0.05 + i * 0.001);
        }

        for (int i = 0; i < 250; i++) {
            repo.uniformGene(String.format("ENSGF%05d", i), String.format("FILL%03d", i), LAYERS, 0.30 + i * 0.001);
        }

        for (int i = 0; i < 5; i++) {
            repo.gene(String.format("ENSGN%05d", i), String.format("NOEV%d", i), Map.of());
        }
        return repo;
    }
}
