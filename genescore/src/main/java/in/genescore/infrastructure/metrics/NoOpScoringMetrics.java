package in.genescore.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics sink used when no registry is configured.
 */
public final class NoOpScoringMetrics implements ScoringMetrics {

    public static final NoOpScoringMetrics INSTANCE = new NoOpScoringMetrics();

    private NoOpScoringMetrics() {}

    @Override
    public void recordAggregation(int totalGenes, int scoredGenes, Duration duration) {}

    @Override
    public void recordQcFindings(int errors, int warnings) {}

    @Override
    public void recordValidation(String prong, boolean passed) {}

    @Override
    public void recordPerturbation(String layer, String stability) {}
}
