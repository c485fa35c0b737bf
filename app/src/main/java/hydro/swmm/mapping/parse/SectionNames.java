package hydro.swmm.mapping.parse;

import java.util.List;

/**
 * Names of the model description sections read by validation and slot discovery.
 */
public final class SectionNames {

    public static final String OPTIONS = "OPTIONS";
    public static final String RAINGAGES = "RAINGAGES";
    public static final String SUBCATCHMENTS = "SUBCATCHMENTS";
    public static final String SUBAREAS = "SUBAREAS";
    public static final String INFILTRATION = "INFILTRATION";
    public static final String JUNCTIONS = "JUNCTIONS";
    public static final String OUTFALLS = "OUTFALLS";
    public static final String STORAGE = "STORAGE";
    public static final String CONDUITS = "CONDUITS";
    public static final String PUMPS = "PUMPS";
    public static final String ORIFICES = "ORIFICES";
    public static final String WEIRS = "WEIRS";
    public static final String XSECTIONS = "XSECTIONS";
    public static final String CONTROLS = "CONTROLS";
    public static final String DWF = "DWF";

    /** Sections whose rows declare nodes. */
    public static final List<String> NODE_SECTIONS = List.of(JUNCTIONS, STORAGE, OUTFALLS);

    private SectionNames() {
    }
}
