package in.genescore.domain.qc;

public enum QcCheck {
    MISSING_DATA,
    DISTRIBUTION,
    OUTLIERS
}
