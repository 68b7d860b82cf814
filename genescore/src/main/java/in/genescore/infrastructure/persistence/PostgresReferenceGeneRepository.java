package in.genescore.infrastructure.persistence;

import in.genescore.application.port.output.ReferenceGeneRepository;
import in.genescore.domain.model.ReferenceGene;
import in.genescore.domain.model.ReferenceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reference gene lists stored in the reference_genes table, one row per
 * (set, symbol, source).
 */
public final class PostgresReferenceGeneRepository implements ReferenceGeneRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresReferenceGeneRepository.class);

    private final DataSource dataSource;

    public PostgresReferenceGeneRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<ReferenceGene> findReferenceGenes(ReferenceSet set) {
        String sql = """
                SELECT gene_symbol, source, confidence
                FROM reference_genes
                WHERE reference_set = ?
                ORDER BY source, gene_symbol
                """;

        List<ReferenceGene> genes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, set.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    genes.add(new ReferenceGene(
                        rs.getString("gene_symbol"),
                        rs.getString("source"),
                        rs.getString("confidence")));
                }
            }

        } catch (SQLException e) {
            log.error("Error loading reference genes {}: {}", set, e.getMessage(), e);
            throw new EvidenceStoreException("reference_genes", "select", "Failed to load " + set, e);
        }

        log.debug("Loaded {} reference rows for {}", genes.size(), set);
        return genes;
    }

    /**
     * Replace one reference set.
     *
     * @return number of unique symbols stored
     */
    public int saveAll(ReferenceSet set, List<ReferenceGene> genes) {
        String deleteSql = "DELETE FROM reference_genes WHERE reference_set = ?";
        String insertSql = """
                INSERT INTO reference_genes (reference_set, gene_symbol, source, confidence)
                VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(deleteSql);
                    PreparedStatement ps = conn.prepareStatement(insertSql)) {

                delete.setString(1, set.name());
                delete.executeUpdate();

                for (ReferenceGene gene : genes) {
                    ps.setString(1, set.name());
                    ps.setString(2, gene.geneSymbol());
                    ps.setString(3, gene.source());
                    ps.setString(4, gene.confidence());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Error saving reference genes {}: {}", set, e.getMessage(), e);
            throw new EvidenceStoreException("reference_genes", "replace", "Failed to save " + set, e);
        }

        int unique = (int) genes.stream().map(ReferenceGene::geneSymbol).distinct().count();
        log.info("Saved {} reference rows ({} unique symbols) for {}", genes.size(), unique, set);
        return unique;
    }
}
