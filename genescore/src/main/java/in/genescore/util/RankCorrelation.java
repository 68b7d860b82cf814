package in.genescore.util;

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;

/**
 * Spearman rank correlation with a two-sided p-value.
 * Ties get average ranks.
 */
public final class RankCorrelation {

    /**
     * @param rho correlation, null when undefined (constant input)
     * @param pValue two-sided p-value from a t-distribution with n-2 degrees of freedom
     */
    public record Result(Double rho, Double pValue, int n) {}

    public static Result spearman(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Arrays differ in length: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        if (n < 3) {
            return new Result(null, null, n);
        }

        double rho = new SpearmansCorrelation().correlation(x, y);
        if (Double.isNaN(rho)) {
            return new Result(null, null, n);
        }
        return new Result(rho, pValue(rho, n), n);
    }

    static double pValue(double rho, int n) {
        if (Math.abs(rho) >= 1.0) {
            return 0.0;
        }
        int df = n - 2;
        double t = rho * Math.sqrt(df / (1.0 - rho * rho));
        TDistribution dist = new TDistribution(df);
        return 2.0 * (1.0 - dist.cumulativeProbability(Math.abs(t)));
    }

    private RankCorrelation() {}
}
