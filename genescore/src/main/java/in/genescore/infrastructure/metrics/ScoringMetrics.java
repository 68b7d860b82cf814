package in.genescore.infrastructure.metrics;

import java.time.Duration;

/**
 * Scoring and validation metrics for monitoring.
 *
 * Key metrics:
 * - Aggregation runs and duration
 * - Genes scored per run
 * - QC findings by severity
 * - Validation outcome per prong
 * - Perturbations by stability
 */
public interface ScoringMetrics {

    /**
     * Record a completed aggregation run.
     *
     * @param totalGenes Genes in the universe
     * @param scoredGenes Genes with a composite score
     * @param duration Wall time of the run
     */
    void recordAggregation(int totalGenes, int scoredGenes, Duration duration);

    /**
     * Record QC findings of one report.
     */
    void recordQcFindings(int errors, int warnings);

    /**
     * Record one validation prong outcome.
     *
     * @param prong positive | negative
     * @param passed Whether the prong passed
     */
    void recordValidation(String prong, boolean passed);

    /**
     * Record one perturbation.
     *
     * @param layer Perturbed layer
     * @param stability stable | unstable | undefined
     */
    void recordPerturbation(String layer, String stability);
}
