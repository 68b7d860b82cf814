package in.genescore.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.genescore.application.port.output.ScoredGeneRepository;
import in.genescore.domain.model.ScoredGene;
import in.genescore.domain.model.ScoredGeneSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;

/**
 * Stores the scored genes of the latest run. Each run replaces the previous table
 * contents in one transaction and appends a row to scoring_runs.
 */
public final class PostgresScoredGeneRepository implements ScoredGeneRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresScoredGeneRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int BATCH_SIZE = 1000;

    private final DataSource dataSource;

    public PostgresScoredGeneRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void replaceAll(ScoredGeneSet scoredGenes) {
        String insertSql = """
                INSERT INTO scored_genes (gene_id, gene_symbol, composite_score, evidence_count,
                    quality_flag, layer_scores, layer_contributions, scored_at)
                VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?)
                """;
        String runSql = """
                INSERT INTO scoring_runs (scored_at, gene_count, scored_count, weights)
                VALUES (?, ?, ?, ?::jsonb)
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement delete = conn.createStatement();
                    PreparedStatement ps = conn.prepareStatement(insertSql);
                    PreparedStatement run = conn.prepareStatement(runSql)) {

                int deleted = delete.executeUpdate("DELETE FROM scored_genes");
                log.debug("Cleared {} previously scored genes", deleted);

                Timestamp scoredAt = Timestamp.from(scoredGenes.scoredAt());
                int count = 0;
                for (ScoredGene gene : scoredGenes.genes()) {
                    ps.setString(1, gene.geneId());
                    ps.setString(2, gene.geneSymbol());
                    if (gene.compositeScore() != null) {
                        ps.setDouble(3, gene.compositeScore());
                    } else {
                        ps.setNull(3, Types.DOUBLE);
                    }
                    ps.setInt(4, gene.evidenceCount());
                    ps.setString(5, gene.qualityFlag().label());
                    ps.setString(6, MAPPER.writeValueAsString(gene.layerScores()));
                    ps.setString(7, MAPPER.writeValueAsString(gene.layerContributions()));
                    ps.setTimestamp(8, scoredAt);
                    ps.addBatch();
                    count++;

                    if (count % BATCH_SIZE == 0) {
                        ps.executeBatch();
                    }
                }
                ps.executeBatch();

                run.setTimestamp(1, scoredAt);
                run.setInt(2, scoredGenes.size());
                run.setInt(3, scoredGenes.scoredCount());
                run.setString(4, MAPPER.writeValueAsString(scoredGenes.weights().weights()));
                run.executeUpdate();

                conn.commit();
                log.info("Saved {} scored genes", count);

            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error saving scored genes: {}", e.getMessage(), e);
            throw new EvidenceStoreException("scored_genes", "replace", "Failed to save scored genes", e);
        }
    }

    @Override
    public int count() {
        String sql = "SELECT COUNT(*) FROM scored_genes";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;

        } catch (SQLException e) {
            log.error("Error counting scored genes: {}", e.getMessage(), e);
            throw new EvidenceStoreException("scored_genes", "count", "Failed to count scored genes", e);
        }
    }
}
