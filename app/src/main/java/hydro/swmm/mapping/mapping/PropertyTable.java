package hydro.swmm.mapping.mapping;

import hydro.swmm.mapping.discovery.InputObjectType;
import hydro.swmm.mapping.discovery.ValueKind;

/**
 * Fixed lookup from slot category to the engine property the bridge reads or writes.
 */
public final class PropertyTable {

    public static final String UNKNOWN = "UNKNOWN";

    private PropertyTable() {
    }

    public static String inputProperty(InputObjectType objectType) {
        if (objectType == null) {
            return UNKNOWN;
        }
        return switch (objectType) {
            case SYSTEM -> "ELAPSEDTIME";
            case GAGE -> "RAINFALL";
            case PUMP, ORIFICE, WEIR -> "SETTING";
            case NODE -> "LATFLOW";
        };
    }

    public static String outputProperty(ValueKind valueKind) {
        if (valueKind == null) {
            return UNKNOWN;
        }
        return switch (valueKind) {
            case VOLUME -> "VOLUME";
            case FLOW -> "FLOW";
            case RUNOFF -> "RUNOFF";
            case INFLOW -> "INFLOW";
        };
    }
}
