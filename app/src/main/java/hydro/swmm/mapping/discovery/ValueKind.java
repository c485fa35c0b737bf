package hydro.swmm.mapping.discovery;

/**
 * Quantity reported by an output slot.
 */
public enum ValueKind {
    VOLUME,
    FLOW,
    RUNOFF,
    INFLOW
}
