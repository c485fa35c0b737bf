package hydro.swmm.mapping.discovery;

import java.util.List;

/**
 * Slots found in a model plus the reference warnings raised while looking for them.
 */
public record DiscoveryResult(List<InputSlot> inputs, List<OutputSlot> outputs, List<String> warnings) {

    public DiscoveryResult {
        inputs = List.copyOf(inputs == null ? List.of() : inputs);
        outputs = List.copyOf(outputs == null ? List.of() : outputs);
        warnings = List.copyOf(warnings == null ? List.of() : warnings);
    }
}
