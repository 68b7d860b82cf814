package in.genescore.service.report;

import in.genescore.domain.report.OverallVerdict;
import in.genescore.domain.report.ValidationReport;
import in.genescore.domain.sensitivity.SensitivityPerturbation;
import in.genescore.domain.sensitivity.SensitivityResult;
import in.genescore.domain.sensitivity.SensitivitySummary;
import in.genescore.domain.validation.NegativeControlResult;
import in.genescore.domain.validation.PercentileValidationResult;
import in.genescore.domain.validation.PositiveControlResult;
import in.genescore.domain.validation.RecallAtK;
import in.genescore.domain.validation.SourceBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Combines the three validation prongs into one verdict and a markdown report.
 *
 * Sections: positive controls, negative controls, sensitivity, overall summary,
 * weight tuning recommendations.
 */
public final class ValidationReportSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(ValidationReportSynthesizer.class);

    private final WeightTuningAdvisor advisor;

    public ValidationReportSynthesizer() {
        this(new WeightTuningAdvisor());
    }

    public ValidationReportSynthesizer(WeightTuningAdvisor advisor) {
        this.advisor = advisor;
    }

    public ValidationReport synthesize(PositiveControlResult positive,
                                       NegativeControlResult negative,
                                       SensitivityResult sensitivity,
                                       SensitivitySummary summary) {
        boolean posPassed = positive.passed();
        boolean negPassed = negative.passed();
        boolean sensStable = summary.overallStable();
        OverallVerdict verdict = OverallVerdict.of(posPassed, negPassed, sensStable);
        List<String> recommendations = advisor.recommend(positive, negative, summary);

        List<String> md = new ArrayList<>();
        md.add("# Comprehensive Validation Report");
        md.add("");
        positiveSection(md, positive);
        negativeSection(md, negative);
        sensitivitySection(md, sensitivity, summary);
        overallSection(md, verdict, posPassed, negPassed, sensStable);
        recommendationSection(md, verdict, recommendations);

        log.info("Validation report: {} (positive={}, negative={}, sensitivity={})",
            verdict.label(), posPassed, negPassed, sensStable);
        return new ValidationReport(verdict, posPassed, negPassed, sensStable, recommendations, String.join("\n", md));
    }

    private void positiveSection(List<String> md, PositiveControlResult positive) {
        PercentileValidationResult r = positive.ranking();
        md.add("## 1. Positive Control Validation");
        md.add("");
        md.add("**Status:** " + status(r.validationPassed()));
        md.add("");
        md.add("### Summary");
        md.add("- Known genes expected: " + r.expectedCount());
        md.add("- Known genes found: " + r.foundCount());
        md.add("- Median percentile: " + percentOrNa(r.medianPercentile()));
        md.add("- Top quartile count: " + r.topQuartileCount());
        md.add("- Top quartile fraction: " + percent(r.topQuartileFraction()));
        if (r.reason() != null) {
            md.add("- Reason: " + r.reason());
        }
        md.add("");

        RecallAtK recall = positive.recallAtK();
        if (!recall.absolute().isEmpty() || !recall.percentage().isEmpty()) {
            md.add("### Recall@k");
            md.add("");
            md.add(String.format(Locale.ROOT, "Denominator: %d of %d unique known genes have a composite score (%d scored genes).",
                recall.totalReferenceInDataset(), recall.totalReferenceUnique(), recall.totalScored()));
            md.add("");
            md.add("| Threshold | Recall |");
            md.add("|-----------|--------|");
            recall.absolute().forEach((k, v) -> md.add("| Top " + k + " | " + percent(v) + " |"));
            recall.percentage().forEach((k, v) -> md.add("| Top " + k + " | " + percent(v) + " |"));
            md.add("");
        }

        if (!positive.perSource().isEmpty()) {
            md.add("### Per-Source Breakdown");
            md.add("");
            md.add("| Source | Count | Median Percentile | Top Quartile |");
            md.add("|--------|-------|-------------------|--------------|");
            for (SourceBreakdown s : positive.perSource().values()) {
                md.add("| " + s.source() + " | " + s.count() + " | " + percentOrNa(s.medianPercentile())
                    + " | " + s.topQuartileCount() + " |");
            }
            md.add("");
        }

        if (r.validationPassed()) {
            md.add("**Verdict:** Known genes rank highly (median >= " + percent(r.threshold())
                + " percentile), supporting scoring sensitivity.");
        } else if (r.foundCount() == 0) {
            md.add("**Verdict:** No known gene was found in the scored dataset (" + r.reason()
                + "); check gene symbol mapping.");
        } else {
            md.add("**Verdict:** Known genes rank below the expected threshold, suggesting issues with "
                + "evidence layer weights or data quality.");
        }
        md.add("");
    }

    private void negativeSection(List<String> md, NegativeControlResult negative) {
        PercentileValidationResult r = negative.ranking();
        md.add("## 2. Negative Control Validation");
        md.add("");
        md.add("**Status:** " + status(r.validationPassed()));
        md.add("");
        md.add("### Summary");
        md.add("- Housekeeping genes expected: " + r.expectedCount());
        md.add("- Housekeeping genes found: " + r.foundCount());
        md.add("- Median percentile: " + percentOrNa(r.medianPercentile()));
        md.add("- Top quartile count: " + r.topQuartileCount());
        md.add(String.format(Locale.ROOT, "- High-tier count (score >= %.2f): %d",
            negative.highTierThreshold(), negative.highTierCount()));
        if (r.reason() != null) {
            md.add("- Reason: " + r.reason());
        }
        md.add("");
        if (r.validationPassed()) {
            md.add("**Verdict:** Housekeeping genes rank low (median < " + percent(r.threshold())
                + " percentile), supporting scoring specificity.");
        } else if (r.foundCount() == 0) {
            md.add("**Verdict:** No housekeeping gene was found in the scored dataset (" + r.reason() + ").");
        } else {
            md.add("**Verdict:** Housekeeping genes rank higher than expected, indicating a possible lack "
                + "of specificity.");
        }
        md.add("");
    }

    private void sensitivitySection(List<String> md, SensitivityResult result, SensitivitySummary summary) {
        md.add("## 3. Sensitivity Analysis");
        md.add("");
        md.add("**Status:** " + (summary.overallStable() ? "STABLE ✓" : "UNSTABLE ✗"));
        md.add("");
        md.add("### Summary");
        md.add("- Total perturbations: " + summary.totalPerturbations());
        md.add(String.format(Locale.ROOT, "- Stable perturbations (rho >= %.2f): %d",
            result.stabilityThreshold(), summary.stableCount()));
        md.add("- Unstable perturbations: " + summary.unstableCount());
        md.add("- Undefined (insufficient overlap): " + summary.undefinedCount());
        if (summary.meanRho() != null) {
            md.add(String.format(Locale.ROOT, "- Mean Spearman rho: %.4f", summary.meanRho()));
            md.add(String.format(Locale.ROOT, "- Range: [%.4f, %.4f]", summary.minRho(), summary.maxRho()));
        } else {
            md.add("- Mean Spearman rho: N/A");
        }
        if (summary.mostSensitiveLayer() != null) {
            md.add("- Most sensitive layer: " + summary.mostSensitiveLayer());
            md.add("- Most robust layer: " + summary.mostRobustLayer());
        }
        md.add("");

        md.add("### Spearman Correlation by Perturbation");
        md.add("");
        md.add("| Layer | Delta | Spearman rho | p-value | Overlap | Stable? |");
        md.add("|-------|-------|--------------|---------|---------|---------|");
        for (SensitivityPerturbation p : result.perturbations()) {
            Boolean stable = p.stable();
            md.add(String.format(Locale.ROOT, "| %s | %+.2f | %s | %s | %d/%d | %s |",
                p.layer(),
                p.delta(),
                p.spearmanRho() == null ? "N/A" : String.format(Locale.ROOT, "%.4f", p.spearmanRho()),
                p.spearmanPValue() == null ? "N/A" : String.format(Locale.ROOT, "%.2e", p.spearmanPValue()),
                p.overlapCount(),
                p.topN(),
                stable == null ? "N/A" : stable ? "✓" : "✗"));
        }
        md.add("");

        if (summary.overallStable()) {
            md.add("**Verdict:** Weight perturbations produce stable rankings, supporting result robustness.");
        } else {
            md.add("**Verdict:** Some perturbations produce unstable or undefined rankings; results may be "
                + "sensitive to weight choices.");
        }
        md.add("");
    }

    private void overallSection(List<String> md, OverallVerdict verdict,
                                boolean posPassed, boolean negPassed, boolean sensStable) {
        md.add("## 4. Overall Validation Summary");
        md.add("");
        md.add("**Status:** " + verdict.label());
        md.add("");
        md.add("**Verdict:** " + describe(verdict));
        md.add("");
        md.add("| Validation Prong | Status | Verdict |");
        md.add("|------------------|--------|---------|");
        md.add("| Positive Controls | " + status(posPassed) + " | Known genes rank " + (posPassed ? "high" : "low") + " |");
        md.add("| Negative Controls | " + status(negPassed) + " | Housekeeping genes rank " + (negPassed ? "low" : "high") + " |");
        md.add("| Sensitivity Analysis | " + (sensStable ? "STABLE ✓" : "UNSTABLE ✗") + " | Rankings "
            + (sensStable ? "stable" : "unstable") + " under perturbations |");
        md.add("");
    }

    private void recommendationSection(List<String> md, OverallVerdict verdict, List<String> recommendations) {
        md.add("## 5. Weight Tuning Recommendations");
        md.add("");
        if (verdict == OverallVerdict.ALL_PASSED) {
            md.add("**Recommendation:** " + recommendations.get(0));
            md.add("");
            return;
        }
        md.add("**Recommendations for Weight Tuning:**");
        md.add("");
        for (String line : recommendations) {
            if (line.equals(WeightTuningAdvisor.CIRCULAR_VALIDATION_WARNING)) {
                md.add("");
                md.add("### CRITICAL: Circular Validation Risk");
                md.add("");
                md.add("**WARNING:** " + line);
            } else if (line.equals(WeightTuningAdvisor.HOLD_OUT_REQUIREMENT)) {
                md.add("");
                md.add(line);
            } else {
                md.add("- " + line);
            }
        }
        md.add("");
    }

    static String describe(OverallVerdict verdict) {
        return switch (verdict) {
            case ALL_PASSED -> "Known genes rank high, housekeeping genes rank low and rankings are robust to weight "
                + "perturbations.";
            case PARTIAL_PASS_SENSITIVITY_UNSTABLE ->
                "Positive and negative controls passed, but rankings are sensitive to weight perturbations.";
            case PARTIAL_PASS_SPECIFICITY_ISSUE ->
                "Known genes rank highly, but housekeeping genes also rank higher than expected.";
            case FAILED ->
                "Known genes do not rank highly; evidence layer weights or data quality require investigation.";
        };
    }

    private static String status(boolean passed) {
        return passed ? "PASSED ✓" : "FAILED ✗";
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100);
    }

    private static String percentOrNa(Double value) {
        return value == null ? "N/A" : percent(value);
    }
}
