package hydro.swmm.mapping.discovery;

/**
 * Categories of model elements whose results are read out after each step.
 * {@code JUNCTION}, {@code PUMP} and {@code CONDUIT} only arise from explicit output selection.
 */
public enum OutputObjectType {
    STORAGE,
    OUTFALL,
    ORIFICE,
    WEIR,
    SUBCATCH,
    JUNCTION,
    PUMP,
    CONDUIT
}
