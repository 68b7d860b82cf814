package in.genescore.service.validation;

import in.genescore.application.port.output.ReferenceGeneRepository;
import in.genescore.domain.model.ReferenceGene;
import in.genescore.domain.model.ReferenceSet;
import in.genescore.domain.model.ScoredGene;
import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.validation.NegativeControlResult;
import in.genescore.domain.validation.PercentileValidationResult;
import in.genescore.domain.validation.PositiveControlResult;
import in.genescore.domain.validation.RankedGene;
import in.genescore.domain.validation.RecallAtK;
import in.genescore.domain.validation.SourceBreakdown;
import in.genescore.infrastructure.metrics.NoOpScoringMetrics;
import in.genescore.infrastructure.metrics.ScoringMetrics;
import in.genescore.util.ScoreStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks where curated control genes fall in the composite ranking.
 *
 * Positive controls (known cilia / Usher genes) must reach a median percentile of at
 * least 0.75. Negative controls (housekeeping genes) must stay below a median of 0.50.
 * Finding no reference gene at all fails the prong with a named reason.
 */
public final class ControlValidator {
    private static final Logger log = LoggerFactory.getLogger(ControlValidator.class);

    public static final double DEFAULT_POSITIVE_THRESHOLD = 0.75;
    public static final double DEFAULT_NEGATIVE_THRESHOLD = 0.50;
    public static final double TOP_QUARTILE = 0.75;
    public static final double HIGH_TIER_SCORE = 0.70;
    public static final int DETAIL_LIMIT = 20;

    public static final List<Integer> RECALL_K_ABSOLUTE = List.of(100, 500, 1000, 2000);
    public static final List<Double> RECALL_K_FRACTIONS = List.of(0.05, 0.10, 0.20);

    private final ReferenceGeneRepository referenceRepository;
    private final ScoringMetrics metrics;

    public ControlValidator(ReferenceGeneRepository referenceRepository) {
        this(referenceRepository, NoOpScoringMetrics.INSTANCE);
    }

    public ControlValidator(ReferenceGeneRepository referenceRepository, ScoringMetrics metrics) {
        this.referenceRepository = referenceRepository;
        this.metrics = metrics;
    }

    public PositiveControlResult validatePositiveControls(ScoredGeneSet scored) {
        return validatePositiveControls(scored, DEFAULT_POSITIVE_THRESHOLD);
    }

    public PositiveControlResult validatePositiveControls(ScoredGeneSet scored, double threshold) {
        requireThreshold(threshold);
        List<ReferenceGene> references = referenceRepository.findReferenceGenes(ReferenceSet.POSITIVE_CONTROLS);
        Map<String, PercentileRanker.Entry> ranking = PercentileRanker.rankBySymbol(scored);
        List<RankedGene> matched = match(references, ranking);
        int expected = uniqueSymbols(references).size();

        PercentileValidationResult result;
        if (matched.isEmpty()) {
            log.error("Positive controls: none of {} known genes found in scored dataset", expected);
            result = PercentileValidationResult.notFound(expected, threshold,
                PercentileValidationResult.NO_KNOWN_GENES_FOUND);
        } else {
            double median = medianPercentile(matched);
            int topQuartile = topQuartileCount(matched);
            boolean passed = median >= threshold;

            List<RankedGene> details = matched.stream()
                .sorted(Comparator.comparingDouble(RankedGene::percentileRank).reversed()
                    .thenComparing(RankedGene::geneSymbol))
                .limit(DETAIL_LIMIT)
                .toList();

            result = new PercentileValidationResult(
                expected,
                matched.size(),
                median,
                topQuartile,
                (double) topQuartile / matched.size(),
                threshold,
                passed,
                details,
                passed ? null : PercentileValidationResult.MEDIAN_BELOW_THRESHOLD);

            if (passed) {
                log.info("Positive controls PASSED: median percentile {} >= {} ({} of {} found, {} in top quartile)",
                    pct(median), pct(threshold), matched.size(), expected, topQuartile);
            } else {
                log.warn("Positive controls FAILED: median percentile {} < {} ({} of {} found)",
                    pct(median), pct(threshold), matched.size(), expected);
            }
        }

        metrics.recordValidation("positive", result.validationPassed());
        return new PositiveControlResult(
            result,
            computeRecallAtK(scored, references),
            perSourceBreakdown(references, matched),
            referenceLayerMeans(scored, matched));
    }

    public NegativeControlResult validateNegativeControls(ScoredGeneSet scored) {
        return validateNegativeControls(scored, DEFAULT_NEGATIVE_THRESHOLD);
    }

    public NegativeControlResult validateNegativeControls(ScoredGeneSet scored, double threshold) {
        requireThreshold(threshold);
        List<ReferenceGene> references = referenceRepository.findReferenceGenes(ReferenceSet.NEGATIVE_CONTROLS);
        Map<String, PercentileRanker.Entry> ranking = PercentileRanker.rankBySymbol(scored);
        List<RankedGene> matched = match(references, ranking);
        int expected = uniqueSymbols(references).size();

        PercentileValidationResult result;
        int highTier = 0;
        if (matched.isEmpty()) {
            log.error("Negative controls: none of {} housekeeping genes found in scored dataset", expected);
            result = PercentileValidationResult.notFound(expected, threshold,
                PercentileValidationResult.NO_HOUSEKEEPING_GENES_FOUND);
        } else {
            double median = medianPercentile(matched);
            int topQuartile = topQuartileCount(matched);
            highTier = (int) matched.stream().filter(g -> g.compositeScore() >= HIGH_TIER_SCORE).count();
            boolean passed = median < threshold;

            List<RankedGene> details = matched.stream()
                .sorted(Comparator.comparingDouble(RankedGene::percentileRank)
                    .thenComparing(RankedGene::geneSymbol))
                .limit(DETAIL_LIMIT)
                .toList();

            result = new PercentileValidationResult(
                expected,
                matched.size(),
                median,
                topQuartile,
                (double) topQuartile / matched.size(),
                threshold,
                passed,
                details,
                passed ? null : PercentileValidationResult.MEDIAN_NOT_BELOW_THRESHOLD);

            if (passed) {
                log.info("Negative controls PASSED: median percentile {} < {} ({} of {} found, {} high tier)",
                    pct(median), pct(threshold), matched.size(), expected, highTier);
            } else {
                log.warn("Negative controls FAILED: median percentile {} >= {} ({} in top quartile, {} high tier)",
                    pct(median), pct(threshold), topQuartile, highTier);
            }
        }

        metrics.recordValidation("negative", result.validationPassed());
        return new NegativeControlResult(result, highTier, HIGH_TIER_SCORE, referenceLayerMeans(scored, matched));
    }

    /**
     * Recall of unique reference symbols in the top-k of the ranking. The denominator is
     * the number of unique reference symbols that have a composite score.
     */
    public static RecallAtK computeRecallAtK(ScoredGeneSet scored, List<ReferenceGene> references) {
        List<ScoredGene> ranked = scored.ranked();
        Set<String> unique = uniqueSymbols(references);

        Set<String> inDataset = new HashSet<>();
        for (ScoredGene gene : ranked) {
            if (gene.geneSymbol() != null && unique.contains(gene.geneSymbol())) {
                inDataset.add(gene.geneSymbol());
            }
        }

        Map<Integer, Double> absolute = new TreeMap<>();
        Map<String, Double> percentage = new LinkedHashMap<>();
        if (!inDataset.isEmpty()) {
            for (int k : RECALL_K_ABSOLUTE) {
                absolute.put(k, recall(ranked, k, inDataset));
            }
            for (double fraction : RECALL_K_FRACTIONS) {
                int k = (int) Math.floor(ranked.size() * fraction);
                percentage.put(Math.round(fraction * 100) + "%", recall(ranked, k, inDataset));
            }
        }

        log.info("Recall@k: {} of {} reference genes scored, absolute={}, percentage={}",
            inDataset.size(), unique.size(), absolute, percentage);
        return new RecallAtK(new TreeMap<>(absolute), percentage, unique.size(), inDataset.size(), ranked.size());
    }

    private static double recall(List<ScoredGene> ranked, int k, Set<String> denominator) {
        Set<String> found = new HashSet<>();
        int limit = Math.min(k, ranked.size());
        for (int i = 0; i < limit; i++) {
            String symbol = ranked.get(i).geneSymbol();
            if (symbol != null && denominator.contains(symbol)) {
                found.add(symbol);
            }
        }
        return (double) found.size() / denominator.size();
    }

    private static List<RankedGene> match(List<ReferenceGene> references, Map<String, PercentileRanker.Entry> ranking) {
        List<RankedGene> matched = new ArrayList<>();
        for (ReferenceGene ref : references) {
            PercentileRanker.Entry entry = ranking.get(ref.geneSymbol());
            if (entry != null) {
                matched.add(new RankedGene(
                    ref.geneSymbol(), entry.gene().compositeScore(), entry.percentile(), ref.source()));
            }
        }
        return matched;
    }

    private static Map<String, SourceBreakdown> perSourceBreakdown(List<ReferenceGene> references,
                                                                  List<RankedGene> matched) {
        Set<String> sources = new LinkedHashSet<>();
        references.forEach(r -> sources.add(r.source()));

        Map<String, SourceBreakdown> breakdown = new LinkedHashMap<>();
        for (String source : sources) {
            List<RankedGene> rows = matched.stream().filter(g -> g.source().equals(source)).toList();
            breakdown.put(source, new SourceBreakdown(
                source,
                rows.size(),
                rows.isEmpty() ? null : medianPercentile(rows),
                topQuartileCount(rows)));
        }
        return breakdown;
    }

    /**
     * Mean present score per layer over the matched genes, one gene per symbol.
     */
    private static Map<String, Double> referenceLayerMeans(ScoredGeneSet scored, List<RankedGene> matched) {
        Set<String> symbols = new HashSet<>();
        matched.forEach(g -> symbols.add(g.geneSymbol()));

        Set<String> seen = new HashSet<>();
        Map<String, List<Double>> perLayer = new LinkedHashMap<>();
        for (String layer : scored.layerNames()) {
            perLayer.put(layer, new ArrayList<>());
        }
        for (ScoredGene gene : scored.ranked()) {
            if (gene.geneSymbol() == null || !symbols.contains(gene.geneSymbol()) || !seen.add(gene.geneSymbol())) {
                continue;
            }
            gene.layerScores().forEach((layer, score) -> perLayer.computeIfAbsent(layer, l -> new ArrayList<>()).add(score));
        }

        Map<String, Double> means = new LinkedHashMap<>();
        perLayer.forEach((layer, scores) -> {
            if (!scores.isEmpty()) {
                means.put(layer, ScoreStatistics.mean(ScoreStatistics.toArray(scores)));
            }
        });
        return means;
    }

    private static double medianPercentile(List<RankedGene> rows) {
        return ScoreStatistics.median(rows.stream().mapToDouble(RankedGene::percentileRank).toArray());
    }

    private static int topQuartileCount(List<RankedGene> rows) {
        return (int) rows.stream().filter(g -> g.percentileRank() >= TOP_QUARTILE).count();
    }

    private static Set<String> uniqueSymbols(List<ReferenceGene> references) {
        Set<String> symbols = new LinkedHashSet<>();
        references.forEach(r -> symbols.add(r.geneSymbol()));
        return symbols;
    }

    private static void requireThreshold(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Percentile threshold must be in [0,1], got " + threshold);
        }
    }

    private static String pct(double value) {
        return String.format("%.1f%%", value * 100);
    }
}
