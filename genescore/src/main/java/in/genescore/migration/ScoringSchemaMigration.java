package in.genescore.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Scoring Schema Migration - creates the tables this engine writes on startup.
 *
 * Creates three tables:
 * - scored_genes: output of the latest aggregation run (replaced each run)
 * - scoring_runs: one row per aggregation run with the weights used
 * - reference_genes: positive and negative control gene lists with provenance
 *
 * Evidence layer tables and gene_universe belong to the loaders and are not touched.
 */
public final class ScoringSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(ScoringSchemaMigration.class);

    private final DataSource dataSource;

    public ScoringSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables.
     */
    public void migrate() {
        log.info("[SCORING MIGRATION] Starting scoring schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "scored_genes", """
                CREATE TABLE scored_genes (
                    gene_id VARCHAR(32) PRIMARY KEY,
                    gene_symbol VARCHAR(64),
                    composite_score DOUBLE PRECISION,
                    evidence_count INT NOT NULL,
                    quality_flag VARCHAR(32) NOT NULL,
                    layer_scores JSONB NOT NULL,
                    layer_contributions JSONB NOT NULL,
                    scored_at TIMESTAMP NOT NULL
                )
                """);
            createIfMissing(conn, "scoring_runs", """
                CREATE TABLE scoring_runs (
                    run_id BIGSERIAL PRIMARY KEY,
                    scored_at TIMESTAMP NOT NULL,
                    gene_count INT NOT NULL,
                    scored_count INT NOT NULL,
                    weights JSONB NOT NULL
                )
                """);
            createIfMissing(conn, "reference_genes", """
                CREATE TABLE reference_genes (
                    reference_set VARCHAR(32) NOT NULL,
                    gene_symbol VARCHAR(64) NOT NULL,
                    source VARCHAR(64) NOT NULL,
                    confidence VARCHAR(16) NOT NULL DEFAULT 'HIGH',
                    PRIMARY KEY (reference_set, gene_symbol, source)
                )
                """);

            log.info("[SCORING MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[SCORING MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Scoring schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws SQLException {
        if (tableExists(conn, table)) {
            log.info("[SCORING MIGRATION] {} table already exists", table);
            return;
        }
        log.info("[SCORING MIGRATION] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("[SCORING MIGRATION] ✓ {} table created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
