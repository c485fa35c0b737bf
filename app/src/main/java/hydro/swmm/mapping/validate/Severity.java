package hydro.swmm.mapping.validate;

/**
 * Severity of a validation issue.
 */
public enum Severity {
    /** Advisory; generation continues. */
    WARNING,
    /** The model would fail in the simulation engine. */
    ERROR
}
