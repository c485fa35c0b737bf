package hydro.swmm.mapping.mapping;

/**
 * Relationship between a model file and a previously generated interface document.
 */
public enum Staleness {
    /** Document fingerprint matches the current model content. */
    FRESH,
    /** Document was generated from different model content. */
    STALE,
    /** No document exists at the expected location. */
    MISSING
}
