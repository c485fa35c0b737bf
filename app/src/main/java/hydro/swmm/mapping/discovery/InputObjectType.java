package hydro.swmm.mapping.discovery;

/**
 * Categories of model elements that can be driven from outside at run time.
 */
public enum InputObjectType {
    SYSTEM,
    GAGE,
    PUMP,
    ORIFICE,
    WEIR,
    NODE
}
