package in.genescore.infrastructure.persistence;

import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.GeneIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostgresEvidenceRepositoryTest {

    private static final EvidenceLayer GNOMAD = EvidenceLayer.of("gnomad", "gnomad_constraint", "loeuf_normalized");

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;
    @Mock
    private Array sqlArray;

    private PostgresEvidenceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PostgresEvidenceRepository(dataSource);
    }

    @Test
    void findGeneUniverse_mapsRowsInQueryOrder() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString("gene_id")).thenReturn("ENSG01", "ENSG02");
        when(resultSet.getString("gene_symbol")).thenReturn("MYO7A", null);

        List<GeneIdentity> genes = repository.findGeneUniverse();

        assertEquals(List.of(new GeneIdentity("ENSG01", "MYO7A"), new GeneIdentity("ENSG02", null)), genes);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertTrue(sql.getValue().contains("ORDER BY gene_id"));
        verify(resultSet).close();
    }

    @Test
    void findLayerScores_skipsNullScoresAndKeepsFirstDuplicate() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(connection.createArrayOf(eq("varchar"), any(Object[].class))).thenReturn(sqlArray);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, true, true, true, false);
        when(resultSet.getString("gene_id")).thenReturn("ENSG01", "ENSG02", "ENSG01", "ENSG03");
        when(resultSet.getDouble("score")).thenReturn(0.5, 0.0, 0.9, 0.0);
        when(resultSet.wasNull()).thenReturn(false, true, false, false);

        Map<String, Double> scores = repository.findLayerScores(GNOMAD, List.of("ENSG01", "ENSG02", "ENSG03"));

        assertEquals(Map.of("ENSG01", 0.5, "ENSG03", 0.0), scores);
        verify(statement).setArray(1, sqlArray);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertTrue(sql.getValue().contains("SELECT gene_id AS gene_id, loeuf_normalized AS score"));
        assertTrue(sql.getValue().contains("FROM gnomad_constraint"));
        assertTrue(sql.getValue().contains("WHERE gene_id = ANY(?)"));
    }

    @Test
    void findLayerScores_emptyIdsDoNotQuery() {
        assertTrue(repository.findLayerScores(GNOMAD, List.of()).isEmpty());
        verifyNoInteractions(dataSource);
    }

    @Test
    void sqlFailureBecomesEvidenceStoreException() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        EvidenceStoreException e = assertThrows(EvidenceStoreException.class,
            () -> repository.findLayerScores(GNOMAD, List.of("ENSG01")));

        assertEquals("gnomad_constraint", e.getTable());
        assertEquals("select", e.getOperation());
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
