package in.genescore.domain.model;

/**
 * The two curated control sets used for validation.
 */
public enum ReferenceSet {
    POSITIVE_CONTROLS,  // known cilia / Usher genes, expected to rank high
    NEGATIVE_CONTROLS   // housekeeping genes, expected to rank low
}
