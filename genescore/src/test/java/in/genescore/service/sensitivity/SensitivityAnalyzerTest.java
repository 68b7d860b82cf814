package in.genescore.service.sensitivity;

import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.model.ScoringWeights;
import in.genescore.domain.sensitivity.SensitivityPerturbation;
import in.genescore.domain.sensitivity.SensitivityResult;
import in.genescore.domain.sensitivity.SensitivitySummary;
import in.genescore.infrastructure.metrics.NoOpScoringMetrics;
import in.genescore.service.scoring.CompositeScoreAggregator;
import in.genescore.testsupport.InMemoryEvidenceRepository;
import in.genescore.testsupport.TestLayers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sensitivity Analyzer Tests")
class SensitivityAnalyzerTest {

    private static final ScoringWeights BASELINE = TestLayers.weights("a", 0.55, "b", 0.45);
    private static final List<Double> DELTAS = List.of(-0.20, 0.20);

    private InMemoryEvidenceRepository repo;
    private CompositeScoreAggregator aggregator;

    /**
     * X genes: a=1.0, b rising. Y genes: a rising, b=1.0.
     * Shifting emphasis towards b swaps the whole top 100 from X to Y.
     */
    @BeforeEach
    void setUp() {
        repo = new InMemoryEvidenceRepository();
        for (int i = 1; i <= 100; i++) {
            repo.gene(String.format("X%03d", i), String.format("GX%03d", i), Map.of("a", 1.0, "b", i / 1000.0));
            repo.gene(String.format("Y%03d", i), String.format("GY%03d", i), Map.of("a", i / 1000.0, "b", 1.0));
        }
        aggregator = new CompositeScoreAggregator(repo, TestLayers.layers("a", "b"));
    }

    @Test
    @DisplayName("Insufficient top-N overlap leaves rho undefined and out of the summary")
    void insufficientOverlap() {
        SensitivityResult result = new SensitivityAnalyzer(aggregator).run(BASELINE, DELTAS, 100);
        List<SensitivityPerturbation> p = result.perturbations();

        assertEquals(4, p.size());
        assertEquals("a", p.get(0).layer());
        assertEquals(-0.20, p.get(0).delta());
        assertNull(p.get(0).spearmanRho());
        assertNull(p.get(0).stable());
        assertEquals(0, p.get(0).overlapCount());

        assertEquals(1.0, p.get(1).spearmanRho(), 1e-12);
        assertEquals(0.0, p.get(1).spearmanPValue(), 1e-9);
        assertEquals(100, p.get(1).overlapCount());
        assertTrue(p.get(1).stable());

        assertEquals(1.0, p.get(2).spearmanRho(), 1e-12);
        assertNull(p.get(3).spearmanRho());

        SensitivitySummary summary = SensitivityAnalyzer.summarize(result);
        assertEquals(1.0, summary.meanRho(), 1e-12);
        assertEquals(2, summary.stableCount());
        assertEquals(0, summary.unstableCount());
        assertEquals(4, summary.totalPerturbations());
        assertEquals(2, summary.undefinedCount());
        assertTrue(summary.overallStable());
    }

    @Test
    @DisplayName("A precomputed baseline is not aggregated again")
    void precomputedBaselineReused() {
        ScoredGeneSet baselineSet = aggregator.aggregate(BASELINE);

        SensitivityResult result = new SensitivityAnalyzer(aggregator).run(baselineSet, DELTAS, 100);

        assertEquals(BASELINE, result.baselineWeights());
        assertEquals(4, result.perturbations().size());
        assertEquals(1 + 4, repo.universeQueries());
        assertEquals(1.0, result.perturbations().get(1).spearmanRho(), 1e-12);
    }

    @Test
    @DisplayName("Perturbed weights stay valid and are recorded")
    void perturbedWeightsRecorded() {
        SensitivityResult result = new SensitivityAnalyzer(aggregator).run(BASELINE, DELTAS, 100);

        for (SensitivityPerturbation p : result.perturbations()) {
            assertEquals(1.0, p.perturbedWeights().sum(), ScoringWeights.SUM_TOLERANCE);
        }
        assertEquals(0.35 / 0.80, result.perturbations().get(0).perturbedWeights().weight("a"), 1e-12);
        assertSame(BASELINE, result.baselineWeights());
    }

    @Test
    @DisplayName("Executor evaluation reports the same results in the same order")
    void executorPreservesOrder() {
        SensitivityResult inline = new SensitivityAnalyzer(aggregator).run(BASELINE, DELTAS, 100);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            SensitivityResult parallel = new SensitivityAnalyzer(aggregator, executor,
                NoOpScoringMetrics.INSTANCE).run(BASELINE, DELTAS, 100);

            assertEquals(inline.perturbations().size(), parallel.perturbations().size());
            for (int i = 0; i < inline.perturbations().size(); i++) {
                SensitivityPerturbation a = inline.perturbations().get(i);
                SensitivityPerturbation b = parallel.perturbations().get(i);
                assertEquals(a.layer(), b.layer());
                assertEquals(a.delta(), b.delta());
                assertEquals(a.spearmanRho(), b.spearmanRho());
                assertEquals(a.overlapCount(), b.overlapCount());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Unknown layer and invalid arguments are rejected")
    void invalidArguments() {
        SensitivityAnalyzer analyzer = new SensitivityAnalyzer(aggregator);

        assertThrows(IllegalArgumentException.class, () -> SensitivityAnalyzer.perturb(BASELINE, "c", 0.05));
        assertThrows(IllegalArgumentException.class, () -> analyzer.run(BASELINE, List.of(), 100));
        assertThrows(IllegalArgumentException.class, () -> analyzer.run(BASELINE, DELTAS, 0));
    }

    @Test
    @DisplayName("Summary ranks layers by mean rho and excludes undefined correlations")
    void summarizeMixedResults() {
        List<SensitivityPerturbation> perturbations = new ArrayList<>();
        perturbations.add(perturbation("a", -0.05, 0.90));
        perturbations.add(perturbation("a", 0.05, 0.80));
        perturbations.add(perturbation("b", -0.05, 0.95));
        perturbations.add(perturbation("b", 0.05, null));
        SensitivityResult result = new SensitivityResult(BASELINE, perturbations, List.of(-0.05, 0.05), 100,
            SensitivityAnalyzer.STABILITY_THRESHOLD);

        SensitivitySummary summary = SensitivityAnalyzer.summarize(result);

        assertEquals(0.80, summary.minRho(), 1e-12);
        assertEquals(0.95, summary.maxRho(), 1e-12);
        assertEquals((0.90 + 0.80 + 0.95) / 3, summary.meanRho(), 1e-12);
        assertEquals(2, summary.stableCount());
        assertEquals(1, summary.unstableCount());
        assertEquals(4, summary.totalPerturbations());
        assertFalse(summary.overallStable());
        assertEquals("a", summary.mostSensitiveLayer());
        assertEquals("b", summary.mostRobustLayer());
        assertEquals(0.85, summary.layerMeanRho().get("a"), 1e-12);
    }

    @Test
    @DisplayName("No defined correlation is not overall stable")
    void summarizeAllUndefined() {
        SensitivityResult result = new SensitivityResult(BASELINE,
            List.of(perturbation("a", 0.05, null), perturbation("b", 0.05, null)),
            List.of(0.05), 100, SensitivityAnalyzer.STABILITY_THRESHOLD);

        SensitivitySummary summary = SensitivityAnalyzer.summarize(result);

        assertNull(summary.meanRho());
        assertFalse(summary.overallStable());
        assertNull(summary.mostSensitiveLayer());
        assertEquals(2, summary.undefinedCount());
    }

    private static SensitivityPerturbation perturbation(String layer, double delta, Double rho) {
        return new SensitivityPerturbation(layer, delta, BASELINE.perturb(layer, delta), rho,
            rho == null ? null : 0.001, rho == null ? 4 : 80, 100, SensitivityAnalyzer.STABILITY_THRESHOLD);
    }
}
