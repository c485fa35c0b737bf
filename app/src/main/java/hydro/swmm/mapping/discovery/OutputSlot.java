package hydro.swmm.mapping.discovery;

import java.util.Objects;

/**
 * Named, indexed output position of the interface contract.
 */
public record OutputSlot(String name, OutputObjectType objectType, ValueKind valueKind, int index) {

    public OutputSlot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(objectType, "objectType");
        Objects.requireNonNull(valueKind, "valueKind");
        if (index < 0) {
            throw new IllegalArgumentException("index must be zero or greater");
        }
    }
}
