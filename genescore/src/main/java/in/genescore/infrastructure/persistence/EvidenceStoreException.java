package in.genescore.infrastructure.persistence;

/**
 * Thrown when the evidence store cannot be read or written. Aborts the run.
 */
public class EvidenceStoreException extends RuntimeException {

    private final String table;
    private final String operation;

    public EvidenceStoreException(String table, String operation, String message) {
        super(String.format("[%s:%s] %s", table, operation, message));
        this.table = table;
        this.operation = operation;
    }

    public EvidenceStoreException(String table, String operation, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", table, operation, message), cause);
        this.table = table;
        this.operation = operation;
    }

    public String getTable() {
        return table;
    }

    public String getOperation() {
        return operation;
    }
}
