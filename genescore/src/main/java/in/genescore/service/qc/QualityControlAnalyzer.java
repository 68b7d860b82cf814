package in.genescore.service.qc;

import in.genescore.domain.model.ScoredGene;
import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.qc.CompositeStats;
import in.genescore.domain.qc.LayerDistribution;
import in.genescore.domain.qc.OutlierSummary;
import in.genescore.domain.qc.QcCheck;
import in.genescore.domain.qc.QcFinding;
import in.genescore.domain.qc.QcReport;
import in.genescore.domain.qc.QcSeverity;
import in.genescore.infrastructure.metrics.NoOpScoringMetrics;
import in.genescore.infrastructure.metrics.ScoringMetrics;
import in.genescore.util.ScoreStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Quality control over a scored gene set.
 *
 * Checks (all advisory, none throws):
 * 1. Missing-data rate per layer: > 80% error, > 50% warning, else info
 * 2. Distribution per layer over present scores: std < 0.01 warning, values outside [0,1] error
 * 3. Robust outliers per layer: |score - median| > 3 × MAD (MAD scaled to a standard deviation)
 *
 * Composite statistics are reported alongside.
 */
public final class QualityControlAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(QualityControlAnalyzer.class);

    public static final double MISSING_RATE_WARN = 0.5;
    public static final double MISSING_RATE_ERROR = 0.8;
    public static final double MIN_STD_THRESHOLD = 0.01;
    public static final double OUTLIER_MAD_MULTIPLIER = 3.0;
    public static final double MAD_EPSILON = 1e-10;
    public static final int MAX_OUTLIER_EXAMPLES = 5;

    private final ScoringMetrics metrics;

    public QualityControlAnalyzer() {
        this(NoOpScoringMetrics.INSTANCE);
    }

    public QualityControlAnalyzer(ScoringMetrics metrics) {
        this.metrics = metrics;
    }

    public QcReport analyze(ScoredGeneSet scored) {
        List<QcFinding> findings = new ArrayList<>();
        List<String> layers = scored.layerNames();

        Map<String, Double> missingRates = missingDataRates(scored, layers, findings);
        Map<String, LayerDistribution> distributions = distributions(scored, layers, findings);
        Map<String, OutlierSummary> outliers = outliers(scored, layers, findings);
        CompositeStats compositeStats = compositeStats(scored);

        QcReport report = new QcReport(missingRates, distributions, outliers, compositeStats, findings);
        metrics.recordQcFindings(report.errors().size(), report.warnings().size());

        if (report.passed()) {
            log.info("QC passed: {} warnings", report.warnings().size());
        } else {
            log.error("QC failed: {} errors, {} warnings", report.errors().size(), report.warnings().size());
        }
        return report;
    }

    Map<String, Double> missingDataRates(ScoredGeneSet scored, List<String> layers, List<QcFinding> findings) {
        Map<String, Double> rates = new LinkedHashMap<>();
        int total = scored.size();

        for (String layer : layers) {
            long missing = scored.genes().stream().filter(g -> !g.layerScores().containsKey(layer)).count();
            double rate = total == 0 ? 1.0 : (double) missing / total;
            rates.put(layer, rate);

            String message = String.format(Locale.ROOT, "%.1f%% missing (%d/%d genes)", rate * 100, missing, total);
            if (rate > MISSING_RATE_ERROR) {
                log.error("Missing data error: {} {}", layer, message);
                findings.add(new QcFinding(QcCheck.MISSING_DATA, QcSeverity.ERROR, layer, message));
            } else if (rate > MISSING_RATE_WARN) {
                log.warn("Missing data warning: {} {}", layer, message);
                findings.add(new QcFinding(QcCheck.MISSING_DATA, QcSeverity.WARNING, layer, message));
            } else {
                findings.add(new QcFinding(QcCheck.MISSING_DATA, QcSeverity.INFO, layer, message));
            }
        }
        return rates;
    }

    Map<String, LayerDistribution> distributions(ScoredGeneSet scored, List<String> layers, List<QcFinding> findings) {
        Map<String, LayerDistribution> result = new LinkedHashMap<>();

        for (String layer : layers) {
            double[] values = presentScores(scored, layer);
            if (values.length == 0) {
                log.warn("Distribution: {} has no data", layer);
                findings.add(new QcFinding(QcCheck.DISTRIBUTION, QcSeverity.WARNING, layer, "no data available"));
                continue;
            }

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            LayerDistribution dist = new LayerDistribution(
                layer,
                values.length,
                ScoreStatistics.mean(values),
                ScoreStatistics.median(values),
                ScoreStatistics.populationStd(values),
                min,
                max);
            result.put(layer, dist);

            if (dist.std() < MIN_STD_THRESHOLD) {
                String message = String.format(Locale.ROOT, "no variation (std=%.4f)", dist.std());
                log.warn("Distribution: {} {}", layer, message);
                findings.add(new QcFinding(QcCheck.DISTRIBUTION, QcSeverity.WARNING, layer, message));
            }
            if (!dist.withinUnitInterval()) {
                String message = String.format(Locale.ROOT, "values outside [0,1] (min=%.4f, max=%.4f)", dist.min(), dist.max());
                log.error("Distribution: {} {}", layer, message);
                findings.add(new QcFinding(QcCheck.DISTRIBUTION, QcSeverity.ERROR, layer, message));
            }
        }
        return result;
    }

    Map<String, OutlierSummary> outliers(ScoredGeneSet scored, List<String> layers, List<QcFinding> findings) {
        Map<String, OutlierSummary> result = new LinkedHashMap<>();

        for (String layer : layers) {
            List<ScoredGene> present = scored.genes().stream()
                .filter(g -> g.layerScores().containsKey(layer))
                .toList();
            if (present.isEmpty()) {
                continue;
            }

            double[] values = present.stream().mapToDouble(g -> g.layerScores().get(layer)).toArray();
            double median = ScoreStatistics.median(values);
            double mad = ScoreStatistics.scaledMad(values);

            if (mad < MAD_EPSILON) {
                log.debug("Outliers: {} skipped, MAD is zero", layer);
                result.put(layer, OutlierSummary.skipped(layer, median));
                continue;
            }

            double limit = OUTLIER_MAD_MULTIPLIER * mad;
            int count = 0;
            List<String> examples = new ArrayList<>();
            for (ScoredGene gene : present) {
                if (Math.abs(gene.layerScores().get(layer) - median) > limit) {
                    count++;
                    if (examples.size() < MAX_OUTLIER_EXAMPLES) {
                        examples.add(gene.geneSymbol() != null ? gene.geneSymbol() : gene.geneId());
                    }
                }
            }
            result.put(layer, new OutlierSummary(layer, median, mad, count, examples, false));

            if (count > 0) {
                String message = String.format(Locale.ROOT, "%d outliers beyond %.1f×MAD (examples: %s)",
                    count, OUTLIER_MAD_MULTIPLIER, String.join(", ", examples));
                log.info("Outliers: {} {}", layer, message);
                findings.add(new QcFinding(QcCheck.OUTLIERS, QcSeverity.INFO, layer, message));
            }
        }
        return result;
    }

    CompositeStats compositeStats(ScoredGeneSet scored) {
        double[] values = scored.ranked().stream().mapToDouble(ScoredGene::compositeScore).toArray();
        if (values.length == 0) {
            return CompositeStats.empty(scored.size());
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new CompositeStats(
            scored.size(),
            values.length,
            ScoreStatistics.mean(values),
            ScoreStatistics.median(values),
            ScoreStatistics.sampleStd(values),
            min,
            max,
            ScoreStatistics.percentile(values, 0.10),
            ScoreStatistics.percentile(values, 0.25),
            ScoreStatistics.percentile(values, 0.50),
            ScoreStatistics.percentile(values, 0.75),
            ScoreStatistics.percentile(values, 0.90));
    }

    private static double[] presentScores(ScoredGeneSet scored, String layer) {
        return scored.genes().stream()
            .map(g -> g.layerScores().get(layer))
            .filter(v -> v != null)
            .mapToDouble(Double::doubleValue)
            .toArray();
    }
}
