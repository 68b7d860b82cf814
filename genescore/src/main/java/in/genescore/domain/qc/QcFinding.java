package in.genescore.domain.qc;

/**
 * A single QC observation, always with a human-readable message.
 */
public record QcFinding(
        QcCheck check,
        QcSeverity severity,
        String layer,
        String message
) {
    @Override
    public String toString() {
        return "[" + severity + "] " + check + " " + layer + ": " + message;
    }
}
