package in.genescore.domain.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Declarative join specification for one evidence layer.
 *
 * The aggregator iterates over an ordered list of these; adding a layer is a
 * new entry, not new query code. Table and column names end up inside SQL text,
 * so they are restricted to plain identifiers.
 */
public record EvidenceLayer(
        String name,        // weight key, e.g. "gnomad"
        String table,       // source table, e.g. "gnomad_constraint"
        String keyColumn,   // gene identifier column
        String scoreColumn  // normalized [0,1] score column
) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static final String DEFAULT_KEY_COLUMN = "gene_id";

    public static final List<EvidenceLayer> DEFAULT_LAYERS = List.of(
            of("gnomad", "gnomad_constraint", "loeuf_normalized"),
            of("expression", "tissue_expression", "expression_score_normalized"),
            of("annotation", "annotation_completeness", "annotation_score_normalized"),
            of("localization", "subcellular_localization", "localization_score_normalized"),
            of("animal_model", "animal_model_phenotypes", "animal_model_score_normalized"),
            of("literature", "literature_evidence", "literature_score_normalized"));

    public EvidenceLayer {
        requireIdentifier("name", name);
        requireIdentifier("table", table);
        requireIdentifier("keyColumn", keyColumn);
        requireIdentifier("scoreColumn", scoreColumn);
    }

    public static EvidenceLayer of(String name, String table, String scoreColumn) {
        return new EvidenceLayer(name, table, DEFAULT_KEY_COLUMN, scoreColumn);
    }

    public static List<String> names(List<EvidenceLayer> layers) {
        return layers.stream().map(EvidenceLayer::name).toList();
    }

    private static void requireIdentifier(String field, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid evidence layer " + field + ": " + value);
        }
    }
}
