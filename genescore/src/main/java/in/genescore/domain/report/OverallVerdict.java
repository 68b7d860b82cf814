package in.genescore.domain.report;

/**
 * Combined outcome of the three validation prongs.
 */
public enum OverallVerdict {
    ALL_PASSED("ALL VALIDATIONS PASSED"),
    PARTIAL_PASS_SENSITIVITY_UNSTABLE("PARTIAL PASS (Sensitivity Unstable)"),
    PARTIAL_PASS_SPECIFICITY_ISSUE("PARTIAL PASS (Specificity Issue)"),
    FAILED("VALIDATION FAILED");

    private final String label;

    OverallVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OverallVerdict of(boolean positivePassed, boolean negativePassed, boolean sensitivityStable) {
        if (!positivePassed) {
            return FAILED;
        }
        if (!negativePassed) {
            return PARTIAL_PASS_SPECIFICITY_ISSUE;
        }
        return sensitivityStable ? ALL_PASSED : PARTIAL_PASS_SENSITIVITY_UNSTABLE;
    }
}
