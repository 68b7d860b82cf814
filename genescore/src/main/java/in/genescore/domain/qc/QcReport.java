package in.genescore.domain.qc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality-control report over one scored gene set.
 */
public record QcReport(
        Map<String, Double> missingRates,                // layer -> fraction of genes without a score
        Map<String, LayerDistribution> distributions,    // absent for layers with no data
        Map<String, OutlierSummary> outliers,
        CompositeStats compositeStats,
        List<QcFinding> findings
) {
    public QcReport {
        missingRates = Collections.unmodifiableMap(new LinkedHashMap<>(missingRates));
        distributions = Collections.unmodifiableMap(new LinkedHashMap<>(distributions));
        outliers = Collections.unmodifiableMap(new LinkedHashMap<>(outliers));
        findings = List.copyOf(findings);
    }

    public List<QcFinding> errors() {
        return bySeverity(QcSeverity.ERROR);
    }

    public List<QcFinding> warnings() {
        return bySeverity(QcSeverity.WARNING);
    }

    public List<QcFinding> info() {
        return bySeverity(QcSeverity.INFO);
    }

    public boolean passed() {
        return errors().isEmpty();
    }

    private List<QcFinding> bySeverity(QcSeverity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }
}
