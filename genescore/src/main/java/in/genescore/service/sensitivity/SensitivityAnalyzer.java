package in.genescore.service.sensitivity;

import in.genescore.domain.model.ScoredGene;
import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.model.ScoringWeights;
import in.genescore.domain.sensitivity.SensitivityPerturbation;
import in.genescore.domain.sensitivity.SensitivityResult;
import in.genescore.domain.sensitivity.SensitivitySummary;
import in.genescore.infrastructure.metrics.NoOpScoringMetrics;
import in.genescore.infrastructure.metrics.ScoringMetrics;
import in.genescore.service.scoring.CompositeScoreAggregator;
import in.genescore.util.RankCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Sensitivity Analyzer - ranking stability under weight perturbation.
 *
 * For each layer and delta the layer's weight is shifted, clamped to [0,1] and all
 * weights renormalized; the universe is re-aggregated and the top-N genes compared to
 * the baseline top-N by Spearman rank correlation over their intersection.
 *
 * Cost: layers × deltas full aggregations on top of the baseline.
 */
public final class SensitivityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SensitivityAnalyzer.class);

    public static final List<Double> DEFAULT_DELTAS = List.of(-0.10, -0.05, 0.05, 0.10);
    public static final double STABILITY_THRESHOLD = 0.85;
    public static final int DEFAULT_TOP_N = 100;
    public static final int MIN_OVERLAP = 10;

    private final CompositeScoreAggregator aggregator;
    private final ExecutorService executor;   // null = evaluate on the calling thread
    private final ScoringMetrics metrics;

    public SensitivityAnalyzer(CompositeScoreAggregator aggregator) {
        this(aggregator, null, NoOpScoringMetrics.INSTANCE);
    }

    public SensitivityAnalyzer(CompositeScoreAggregator aggregator, ExecutorService executor, ScoringMetrics metrics) {
        this.aggregator = aggregator;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Perturb one layer's weight and renormalize.
     *
     * @throws IllegalArgumentException for a layer not in the weight set
     */
    public static ScoringWeights perturb(ScoringWeights baseline, String layer, double delta) {
        return baseline.perturb(layer, delta);
    }

    public SensitivityResult run(ScoringWeights baseline) {
        return run(baseline, DEFAULT_DELTAS, DEFAULT_TOP_N);
    }

    public SensitivityResult run(ScoringWeights baseline, List<Double> deltas, int topN) {
        return run(aggregator.aggregate(baseline), deltas, topN);
    }

    /**
     * Analyze around an already aggregated baseline; only the perturbed weight sets
     * are aggregated.
     */
    public SensitivityResult run(ScoredGeneSet baselineSet, List<Double> deltas, int topN) {
        if (deltas == null || deltas.isEmpty()) {
            throw new IllegalArgumentException("At least one perturbation delta is required");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, got " + topN);
        }

        ScoringWeights baseline = baselineSet.weights();
        List<String> layers = baseline.layers();
        log.info("Sensitivity analysis: {} layers × {} deltas, top {}", layers.size(), deltas.size(), topN);

        Map<String, Double> baselineTop = topScores(baselineSet, topN);

        List<Callable<SensitivityPerturbation>> tasks = new ArrayList<>();
        for (String layer : layers) {
            for (double delta : deltas) {
                ScoringWeights perturbed = baseline.perturb(layer, delta);
                tasks.add(() -> evaluate(layer, delta, perturbed, baselineTop, topN));
            }
        }

        List<SensitivityPerturbation> perturbations = executor == null ? runInline(tasks) : runOnExecutor(tasks);
        for (SensitivityPerturbation p : perturbations) {
            Boolean stable = p.stable();
            metrics.recordPerturbation(p.layer(), stable == null ? "undefined" : stable ? "stable" : "unstable");
        }

        log.info("Sensitivity analysis complete: {} perturbations", perturbations.size());
        return new SensitivityResult(baseline, perturbations, deltas, topN, STABILITY_THRESHOLD);
    }

    private SensitivityPerturbation evaluate(String layer,
                                             double delta,
                                             ScoringWeights perturbed,
                                             Map<String, Double> baselineTop,
                                             int topN) {
        Map<String, Double> perturbedTop = topScores(aggregator.aggregate(perturbed), topN);

        List<String> shared = new ArrayList<>();
        for (String key : baselineTop.keySet()) {
            if (perturbedTop.containsKey(key)) {
                shared.add(key);
            }
        }

        if (shared.size() < MIN_OVERLAP) {
            log.warn("Perturbation {} {}: only {} genes shared in top {}, correlation undefined",
                layer, signed(delta), shared.size(), topN);
            return new SensitivityPerturbation(layer, delta, perturbed, null, null, shared.size(), topN,
                STABILITY_THRESHOLD);
        }

        double[] x = new double[shared.size()];
        double[] y = new double[shared.size()];
        for (int i = 0; i < shared.size(); i++) {
            x[i] = baselineTop.get(shared.get(i));
            y[i] = perturbedTop.get(shared.get(i));
        }
        RankCorrelation.Result corr = RankCorrelation.spearman(x, y);

        log.debug("Perturbation {} {}: rho={}, overlap={}", layer, signed(delta), corr.rho(), shared.size());
        return new SensitivityPerturbation(layer, delta, perturbed, corr.rho(), corr.pValue(), shared.size(), topN,
            STABILITY_THRESHOLD);
    }

    /**
     * Aggregate statistics over the perturbations with a defined rho.
     */
    public static SensitivitySummary summarize(SensitivityResult result) {
        List<SensitivityPerturbation> perturbations = result.perturbations();
        double threshold = result.stabilityThreshold();

        List<Double> rhos = new ArrayList<>();
        Map<String, List<Double>> byLayer = new LinkedHashMap<>();
        for (SensitivityPerturbation p : perturbations) {
            if (p.spearmanRho() != null) {
                rhos.add(p.spearmanRho());
                byLayer.computeIfAbsent(p.layer(), l -> new ArrayList<>()).add(p.spearmanRho());
            }
        }

        if (rhos.isEmpty()) {
            log.warn("Sensitivity summary: no perturbation produced a defined correlation");
            return new SensitivitySummary(null, null, null, 0, 0, perturbations.size(), false, null, null, Map.of());
        }

        int stable = (int) rhos.stream().filter(r -> r >= threshold).count();
        int unstable = rhos.size() - stable;

        Map<String, Double> layerMeans = new LinkedHashMap<>();
        byLayer.forEach((layer, values) ->
            layerMeans.put(layer, values.stream().mapToDouble(Double::doubleValue).average().orElseThrow()));

        String mostSensitive = null;
        String mostRobust = null;
        for (Map.Entry<String, Double> e : layerMeans.entrySet()) {
            if (mostSensitive == null || e.getValue() < layerMeans.get(mostSensitive)) {
                mostSensitive = e.getKey();
            }
            if (mostRobust == null || e.getValue() > layerMeans.get(mostRobust)) {
                mostRobust = e.getKey();
            }
        }

        SensitivitySummary summary = new SensitivitySummary(
            rhos.stream().mapToDouble(Double::doubleValue).min().orElseThrow(),
            rhos.stream().mapToDouble(Double::doubleValue).max().orElseThrow(),
            rhos.stream().mapToDouble(Double::doubleValue).average().orElseThrow(),
            stable,
            unstable,
            perturbations.size(),
            unstable == 0,
            mostSensitive,
            mostRobust,
            layerMeans);

        log.info("Sensitivity summary: mean rho={}, stable={}, unstable={}, undefined={}, overall {}",
            String.format("%.4f", summary.meanRho()), stable, unstable, summary.undefinedCount(),
            summary.overallStable() ? "STABLE" : "UNSTABLE");
        return summary;
    }

    /**
     * Top-N composites keyed by symbol (gene id when the symbol is missing), in ranking order.
     */
    private static Map<String, Double> topScores(ScoredGeneSet scored, int topN) {
        Map<String, Double> top = new LinkedHashMap<>();
        for (ScoredGene gene : scored.topN(topN)) {
            String key = gene.geneSymbol() != null ? gene.geneSymbol() : gene.geneId();
            top.putIfAbsent(key, gene.compositeScore());
        }
        return top;
    }

    private static List<SensitivityPerturbation> runInline(List<Callable<SensitivityPerturbation>> tasks) {
        List<SensitivityPerturbation> results = new ArrayList<>(tasks.size());
        for (Callable<SensitivityPerturbation> task : tasks) {
            try {
                results.add(task.call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Perturbation failed", e);
            }
        }
        return results;
    }

    private List<SensitivityPerturbation> runOnExecutor(List<Callable<SensitivityPerturbation>> tasks) {
        List<Future<SensitivityPerturbation>> futures = new ArrayList<>(tasks.size());
        for (Callable<SensitivityPerturbation> task : tasks) {
            futures.add(executor.submit(task));
        }

        List<SensitivityPerturbation> results = new ArrayList<>(futures.size());
        try {
            for (Future<SensitivityPerturbation> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Sensitivity analysis interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Perturbation failed", e.getCause());
        }
        return results;
    }

    private static String signed(double delta) {
        return String.format("%+.2f", delta);
    }
}
