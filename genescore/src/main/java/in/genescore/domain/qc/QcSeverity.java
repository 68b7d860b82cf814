package in.genescore.domain.qc;

/**
 * Severity of a quality-control finding. QC is advisory; ERROR only fails the QC report.
 */
public enum QcSeverity {
    /**
     * Data is unusable for this layer or a normalization bug is present.
     * Examples: >80% missing, score outside [0,1]
     */
    ERROR,

    /**
     * Worth reviewing before trusting the ranking.
     * Examples: >50% missing, no variation, no data
     */
    WARNING,

    /**
     * Informational only
     */
    INFO
}
