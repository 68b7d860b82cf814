package in.genescore.domain.model;

/**
 * Coarse evidence-coverage bucket, a pure function of evidence count.
 */
public enum QualityFlag {
    SUFFICIENT_EVIDENCE("sufficient_evidence", 4),
    MODERATE_EVIDENCE("moderate_evidence", 2),
    SPARSE_EVIDENCE("sparse_evidence", 1),
    NO_EVIDENCE("no_evidence", 0);

    private final String label;
    private final int minEvidence;

    QualityFlag(String label, int minEvidence) {
        this.label = label;
        this.minEvidence = minEvidence;
    }

    public String label() {
        return label;
    }

    public int minEvidence() {
        return minEvidence;
    }

    public static QualityFlag fromEvidenceCount(int evidenceCount) {
        if (evidenceCount < 0) {
            throw new IllegalArgumentException("Evidence count cannot be negative: " + evidenceCount);
        }
        for (QualityFlag flag : values()) {
            if (evidenceCount >= flag.minEvidence) {
                return flag;
            }
        }
        return NO_EVIDENCE;
    }

    public static QualityFlag fromLabel(String label) {
        for (QualityFlag flag : values()) {
            if (flag.label.equals(label)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unknown quality flag: " + label);
    }
}
