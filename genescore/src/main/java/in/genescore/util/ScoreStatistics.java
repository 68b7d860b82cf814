package in.genescore.util;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Collection;

/**
 * Robust and descriptive statistics over score columns.
 * Every method returns null for an empty input instead of NaN.
 */
public final class ScoreStatistics {

    /**
     * Consistency constant 1/Φ⁻¹(0.75) that makes MAD comparable to a standard deviation.
     */
    public static final double MAD_SCALE = 1.0 / new NormalDistribution().inverseCumulativeProbability(0.75);

    public static double[] toArray(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static Double median(double[] values) {
        if (values.length == 0) return null;
        return new Median().evaluate(values);
    }

    /**
     * Median absolute deviation around the median, scaled by {@link #MAD_SCALE}.
     */
    public static Double scaledMad(double[] values) {
        Double center = median(values);
        if (center == null) return null;
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return new Median().evaluate(deviations) * MAD_SCALE;
    }

    public static Double mean(double[] values) {
        if (values.length == 0) return null;
        return new DescriptiveStatistics(values).getMean();
    }

    public static Double populationStd(double[] values) {
        if (values.length == 0) return null;
        return Math.sqrt(new DescriptiveStatistics(values).getPopulationVariance());
    }

    /**
     * Sample standard deviation (n - 1); null below two values.
     */
    public static Double sampleStd(double[] values) {
        if (values.length < 2) return null;
        return new DescriptiveStatistics(values).getStandardDeviation();
    }

    /**
     * Linear-interpolation percentile (R-7, as PERCENTILE_CONT).
     *
     * @param quantile in (0, 1]
     */
    public static Double percentile(double[] values, double quantile) {
        if (values.length == 0) return null;
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, quantile * 100.0);
    }

    private ScoreStatistics() {}
}
