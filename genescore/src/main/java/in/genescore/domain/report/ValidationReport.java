package in.genescore.domain.report;

import java.util.List;

/**
 * Synthesized validation outcome plus the rendered markdown.
 */
public record ValidationReport(
        OverallVerdict verdict,
        boolean positivePassed,
        boolean negativePassed,
        boolean sensitivityStable,
        List<String> recommendations,
        String markdown
) {
    public ValidationReport {
        recommendations = List.copyOf(recommendations);
    }

    public boolean tuningRecommended() {
        return verdict != OverallVerdict.ALL_PASSED;
    }
}
