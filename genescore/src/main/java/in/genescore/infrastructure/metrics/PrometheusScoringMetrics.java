package in.genescore.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of ScoringMetrics.
 *
 * Key Metrics:
 * - genescore_aggregations_total - Aggregation runs (baseline and perturbed)
 * - genescore_aggregation_duration_seconds - Aggregation wall time
 * - genescore_genes{state} - Genes in the last run (total / scored)
 * - genescore_qc_findings_total{severity} - QC errors and warnings
 * - genescore_validation_passed{prong} - Last outcome per prong (1=passed, 0=failed)
 * - genescore_perturbations_total{layer, stability} - Perturbations by stability
 */
public class PrometheusScoringMetrics implements ScoringMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusScoringMetrics.class);

    private final CollectorRegistry registry;

    private final Counter aggregationCounter;
    private final Histogram aggregationDuration;
    private final Gauge genesGauge;
    private final Counter qcFindingCounter;
    private final Gauge validationGauge;
    private final Counter perturbationCounter;

    public PrometheusScoringMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusScoringMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.aggregationCounter = Counter.build()
            .name("genescore_aggregations_total")
            .help("Total number of composite score aggregations")
            .register(registry);

        this.aggregationDuration = Histogram.build()
            .name("genescore_aggregation_duration_seconds")
            .help("Composite score aggregation duration in seconds")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0, 60.0)
            .register(registry);

        this.genesGauge = Gauge.build()
            .name("genescore_genes")
            .help("Genes in the most recent aggregation")
            .labelNames("state")
            .register(registry);

        this.qcFindingCounter = Counter.build()
            .name("genescore_qc_findings_total")
            .help("Quality control findings by severity")
            .labelNames("severity")
            .register(registry);

        this.validationGauge = Gauge.build()
            .name("genescore_validation_passed")
            .help("Most recent validation outcome per prong (1=passed, 0=failed)")
            .labelNames("prong")
            .register(registry);

        this.perturbationCounter = Counter.build()
            .name("genescore_perturbations_total")
            .help("Sensitivity perturbations by stability")
            .labelNames("layer", "stability")
            .register(registry);

        log.info("Prometheus scoring metrics initialized");
    }

    @Override
    public void recordAggregation(int totalGenes, int scoredGenes, Duration duration) {
        aggregationCounter.inc();
        aggregationDuration.observe(duration.toMillis() / 1000.0);
        genesGauge.labels("total").set(totalGenes);
        genesGauge.labels("scored").set(scoredGenes);
    }

    @Override
    public void recordQcFindings(int errors, int warnings) {
        qcFindingCounter.labels("error").inc(errors);
        qcFindingCounter.labels("warning").inc(warnings);
    }

    @Override
    public void recordValidation(String prong, boolean passed) {
        validationGauge.labels(prong).set(passed ? 1 : 0);
    }

    @Override
    public void recordPerturbation(String layer, String stability) {
        perturbationCounter.labels(layer, stability).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
