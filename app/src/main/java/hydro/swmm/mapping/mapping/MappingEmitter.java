package hydro.swmm.mapping.mapping;

import hydro.swmm.mapping.discovery.InputSlot;
import hydro.swmm.mapping.discovery.OutputSlot;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles discovered slots and the content fingerprint into an {@link InterfaceDocument}.
 */
public class MappingEmitter {

    static final int UNRESOLVED_ENGINE_INDEX = 0;

    public InterfaceDocument emit(List<InputSlot> inputs, List<OutputSlot> outputs, String contentFingerprint) {
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(outputs, "outputs");
        Objects.requireNonNull(contentFingerprint, "contentFingerprint");

        List<InterfaceDocument.InputEntry> inputEntries = new ArrayList<>(inputs.size());
        for (InputSlot slot : inputs) {
            inputEntries.add(new InterfaceDocument.InputEntry(slot.index(), slot.name(),
                    slot.objectType().name(), PropertyTable.inputProperty(slot.objectType())));
        }

        List<InterfaceDocument.OutputEntry> outputEntries = new ArrayList<>(outputs.size());
        for (OutputSlot slot : outputs) {
            outputEntries.add(new InterfaceDocument.OutputEntry(slot.index(), slot.name(),
                    slot.objectType().name(), PropertyTable.outputProperty(slot.valueKind()), UNRESOLVED_ENGINE_INDEX));
        }

        return new InterfaceDocument(InterfaceDocument.CURRENT_VERSION, contentFingerprint,
                inputEntries.size(), outputEntries.size(), inputEntries, outputEntries);
    }
}
