package in.genescore.domain.qc;

import java.util.List;

/**
 * Robust outlier scan for one layer. {@code skipped} is true when the spread is
 * zero and no outlier can be defined; that is not an error.
 */
public record OutlierSummary(
        String layer,
        double median,
        double scaledMad,
        int outlierCount,
        List<String> exampleSymbols,
        boolean skipped
) {
    public OutlierSummary {
        exampleSymbols = List.copyOf(exampleSymbols);
    }

    public static OutlierSummary skipped(String layer, double median) {
        return new OutlierSummary(layer, median, 0.0, 0, List.of(), true);
    }
}
