package hydro.swmm.mapping.discovery;

import java.util.Objects;

/**
 * Named, indexed input position of the interface contract.
 */
public record InputSlot(String name, InputObjectType objectType, int index) {

    public static final String ELAPSED_TIME = "ElapsedTime";

    public InputSlot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(objectType, "objectType");
        if (index < 0) {
            throw new IllegalArgumentException("index must be zero or greater");
        }
    }

    public static InputSlot elapsedTime() {
        return new InputSlot(ELAPSED_TIME, InputObjectType.SYSTEM, 0);
    }
}
