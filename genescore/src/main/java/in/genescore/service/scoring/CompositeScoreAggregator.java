package in.genescore.service.scoring;

import in.genescore.application.port.output.EvidenceRepository;
import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.GeneEvidence;
import in.genescore.domain.model.GeneIdentity;
import in.genescore.domain.model.QualityFlag;
import in.genescore.domain.model.ScoredGene;
import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.model.ScoringWeights;
import in.genescore.infrastructure.metrics.NoOpScoringMetrics;
import in.genescore.infrastructure.metrics.ScoringMetrics;
import in.genescore.util.ScoreStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Composite Score Aggregator - NULL-preserving weighted average over evidence layers.
 *
 * For each gene with present layers A:
 * <pre>
 * composite = Σ_{l∈A}(score_l × weight_l) / Σ_{l∈A}(weight_l)
 * </pre>
 * The denominator adapts to missingness, so a gene scored by one high-weight layer is
 * not penalized relative to one scored by two low-weight layers. A gene with no present
 * layer (or only zero-weight layers) gets no composite, never 0.
 *
 * Every universe gene is emitted, including those absent from all layers.
 */
public final class CompositeScoreAggregator {
    private static final Logger log = LoggerFactory.getLogger(CompositeScoreAggregator.class);

    /**
     * Composite descending, missing composites last, gene id ascending.
     */
    public static final Comparator<ScoredGene> RANKING_ORDER = Comparator
            .<ScoredGene, Double>comparing(ScoredGene::compositeScore, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(ScoredGene::geneId);

    private final EvidenceRepository evidenceRepository;
    private final List<EvidenceLayer> layers;
    private final ScoringMetrics metrics;

    public CompositeScoreAggregator(EvidenceRepository evidenceRepository) {
        this(evidenceRepository, EvidenceLayer.DEFAULT_LAYERS, NoOpScoringMetrics.INSTANCE);
    }

    public CompositeScoreAggregator(EvidenceRepository evidenceRepository, List<EvidenceLayer> layers) {
        this(evidenceRepository, layers, NoOpScoringMetrics.INSTANCE);
    }

    public CompositeScoreAggregator(EvidenceRepository evidenceRepository,
                                    List<EvidenceLayer> layers,
                                    ScoringMetrics metrics) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("At least one evidence layer is required");
        }
        Set<String> names = new HashSet<>();
        for (EvidenceLayer layer : layers) {
            if (!names.add(layer.name())) {
                throw new IllegalArgumentException("Duplicate evidence layer: " + layer.name());
            }
        }
        this.evidenceRepository = evidenceRepository;
        this.layers = List.copyOf(layers);
        this.metrics = metrics;
    }

    public List<EvidenceLayer> layers() {
        return layers;
    }

    /**
     * Left-join every layer onto the gene universe.
     * Logs the per-layer missing rate and the mean evidence count.
     */
    public List<GeneEvidence> joinEvidenceLayers() {
        List<GeneIdentity> universe = evidenceRepository.findGeneUniverse();
        List<String> geneIds = universe.stream().map(GeneIdentity::geneId).toList();

        Map<String, Map<String, Double>> scoresByLayer = new LinkedHashMap<>();
        for (EvidenceLayer layer : layers) {
            Map<String, Double> scores = evidenceRepository.findLayerScores(layer, geneIds);
            scoresByLayer.put(layer.name(), scores);
            log.debug("Layer {} ({}.{}): {} present scores",
                layer.name(), layer.table(), layer.scoreColumn(), scores.size());
        }

        List<GeneEvidence> joined = new ArrayList<>(universe.size());
        for (GeneIdentity gene : universe) {
            Map<String, Double> present = new LinkedHashMap<>();
            for (EvidenceLayer layer : layers) {
                Double score = scoresByLayer.get(layer.name()).get(gene.geneId());
                if (score != null) {
                    present.put(layer.name(), score);
                }
            }
            joined.add(new GeneEvidence(gene.geneId(), gene.geneSymbol(), present));
        }

        logJoinSummary(joined);
        return joined;
    }

    /**
     * Score the whole universe under the given weights.
     *
     * @throws IllegalArgumentException if the weights do not cover exactly the configured
     *     layers; raised before any evidence store query
     */
    public ScoredGeneSet aggregate(ScoringWeights weights) {
        requireMatchingLayers(weights);

        Instant start = Instant.now();
        log.info("Aggregating {} evidence layers with weights {}", layers.size(), weights.weights());

        List<GeneEvidence> evidence = joinEvidenceLayers();
        List<ScoredGene> scored = new ArrayList<>(evidence.size());
        for (GeneEvidence gene : evidence) {
            scored.add(scoreGene(gene, weights));
        }
        scored.sort(RANKING_ORDER);

        ScoredGeneSet result = new ScoredGeneSet(scored, weights, layers, Instant.now());
        metrics.recordAggregation(result.size(), result.scoredCount(), Duration.between(start, Instant.now()));
        logScoringSummary(result);
        return result;
    }

    /**
     * Score one gene. Pure function of its present evidence and the weights.
     */
    public static ScoredGene scoreGene(GeneEvidence gene, ScoringWeights weights) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        double weightedSum = 0.0;
        double availableWeight = 0.0;

        for (Map.Entry<String, Double> e : gene.presentScores().entrySet()) {
            double w = weights.weight(e.getKey());
            double contribution = e.getValue() * w;
            contributions.put(e.getKey(), contribution);
            weightedSum += contribution;
            availableWeight += w;
        }

        int evidenceCount = gene.evidenceCount();
        Double composite = evidenceCount > 0 && availableWeight > 0.0
                ? weightedSum / availableWeight
                : null;

        return new ScoredGene(
                gene.geneId(),
                gene.geneSymbol(),
                gene.presentScores(),
                contributions,
                evidenceCount,
                composite,
                QualityFlag.fromEvidenceCount(evidenceCount));
    }

    private void requireMatchingLayers(ScoringWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Scoring weights cannot be null");
        }
        Set<String> expected = new HashSet<>(EvidenceLayer.names(layers));
        Set<String> actual = new HashSet<>(weights.layers());
        if (!expected.equals(actual)) {
            throw new IllegalArgumentException(
                "Weight layers " + weights.layers() + " do not match evidence layers " + EvidenceLayer.names(layers));
        }
    }

    private void logJoinSummary(List<GeneEvidence> joined) {
        int total = joined.size();
        if (total == 0) {
            log.warn("Gene universe is empty");
            return;
        }
        for (EvidenceLayer layer : layers) {
            long missing = joined.stream().filter(g -> !g.hasScore(layer.name())).count();
            log.info("  {}: missing {}/{} ({}%)", layer.name(), missing, total,
                String.format("%.1f", 100.0 * missing / total));
        }
        double meanEvidence = joined.stream().mapToInt(GeneEvidence::evidenceCount).average().orElse(0.0);
        log.info("Joined {} genes, mean evidence count {}", total, String.format("%.2f", meanEvidence));
    }

    private void logScoringSummary(ScoredGeneSet result) {
        int total = result.size();
        int withScore = result.scoredCount();
        double[] composites = result.ranked().stream().mapToDouble(ScoredGene::compositeScore).toArray();

        Map<QualityFlag, Integer> flags = new EnumMap<>(QualityFlag.class);
        for (ScoredGene gene : result.genes()) {
            flags.merge(gene.qualityFlag(), 1, Integer::sum);
        }

        log.info("Scored {} genes: {} with composite ({}% coverage), mean={}, median={}",
            total,
            withScore,
            total == 0 ? "0.0" : String.format("%.1f", 100.0 * withScore / total),
            format(ScoreStatistics.mean(composites)),
            format(ScoreStatistics.median(composites)));
        log.info("Quality flags: {}", flags);
    }

    private static String format(Double value) {
        return value == null ? "n/a" : String.format("%.4f", value);
    }
}
