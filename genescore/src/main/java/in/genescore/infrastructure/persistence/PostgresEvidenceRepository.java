package in.genescore.infrastructure.persistence;

import in.genescore.application.port.output.EvidenceRepository;
import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.GeneIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the gene universe and per-layer scores from PostgreSQL.
 *
 * Layer queries are built from the layer's declarative table and column names, which
 * EvidenceLayer restricts to plain identifiers.
 */
public final class PostgresEvidenceRepository implements EvidenceRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEvidenceRepository.class);

    public static final String UNIVERSE_TABLE = "gene_universe";

    private final DataSource dataSource;

    public PostgresEvidenceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<GeneIdentity> findGeneUniverse() {
        String sql = """
                SELECT gene_id, gene_symbol
                FROM gene_universe
                ORDER BY gene_id
                """;

        List<GeneIdentity> genes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                genes.add(new GeneIdentity(rs.getString("gene_id"), rs.getString("gene_symbol")));
            }

        } catch (SQLException e) {
            log.error("Error loading gene universe: {}", e.getMessage(), e);
            throw new EvidenceStoreException(UNIVERSE_TABLE, "select", "Failed to load gene universe", e);
        }

        log.info("Loaded gene universe: {} genes", genes.size());
        return genes;
    }

    @Override
    public Map<String, Double> findLayerScores(EvidenceLayer layer, Collection<String> geneIds) {
        Map<String, Double> scores = new HashMap<>();
        if (geneIds.isEmpty()) {
            return scores;
        }

        String sql = String.format("""
                SELECT %1$s AS gene_id, %2$s AS score
                FROM %3$s
                WHERE %1$s = ANY(?)
                """, layer.keyColumn(), layer.scoreColumn(), layer.table());

        int duplicates = 0;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Array ids = conn.createArrayOf("varchar", geneIds.toArray());
            ps.setArray(1, ids);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String geneId = rs.getString("gene_id");
                    double score = rs.getDouble("score");
                    if (rs.wasNull()) {
                        continue;   // NULL score is missing evidence, not 0
                    }
                    if (scores.putIfAbsent(geneId, score) != null) {
                        duplicates++;
                    }
                }
            }

        } catch (SQLException e) {
            log.error("Error loading layer {} from {}: {}", layer.name(), layer.table(), e.getMessage(), e);
            throw new EvidenceStoreException(layer.table(), "select", "Failed to load layer " + layer.name(), e);
        }

        if (duplicates > 0) {
            log.warn("Layer {} has {} duplicate rows in {}; first row kept", layer.name(), duplicates, layer.table());
        }
        return scores;
    }
}
