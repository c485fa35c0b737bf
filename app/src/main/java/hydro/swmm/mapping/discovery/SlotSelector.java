package hydro.swmm.mapping.discovery;

import static hydro.swmm.mapping.parse.SectionNames.CONDUITS;
import static hydro.swmm.mapping.parse.SectionNames.JUNCTIONS;
import static hydro.swmm.mapping.parse.SectionNames.ORIFICES;
import static hydro.swmm.mapping.parse.SectionNames.OUTFALLS;
import static hydro.swmm.mapping.parse.SectionNames.PUMPS;
import static hydro.swmm.mapping.parse.SectionNames.RAINGAGES;
import static hydro.swmm.mapping.parse.SectionNames.STORAGE;
import static hydro.swmm.mapping.parse.SectionNames.SUBCATCHMENTS;
import static hydro.swmm.mapping.parse.SectionNames.WEIRS;

import hydro.swmm.mapping.parse.SectionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds slots from element names chosen by the caller instead of sentinel discovery.
 * The category of each name is taken from the first section, in lookup order, that declares it.
 */
public class SlotSelector {

    private static final List<InputLookup> INPUT_LOOKUP = List.of(
            new InputLookup(RAINGAGES, InputObjectType.GAGE),
            new InputLookup(PUMPS, InputObjectType.PUMP),
            new InputLookup(ORIFICES, InputObjectType.ORIFICE),
            new InputLookup(WEIRS, InputObjectType.WEIR),
            new InputLookup(JUNCTIONS, InputObjectType.NODE),
            new InputLookup(STORAGE, InputObjectType.NODE));

    private static final List<OutputLookup> OUTPUT_LOOKUP = List.of(
            new OutputLookup(SUBCATCHMENTS, OutputObjectType.SUBCATCH, ValueKind.RUNOFF),
            new OutputLookup(STORAGE, OutputObjectType.STORAGE, ValueKind.VOLUME),
            new OutputLookup(JUNCTIONS, OutputObjectType.JUNCTION, ValueKind.INFLOW),
            new OutputLookup(OUTFALLS, OutputObjectType.OUTFALL, ValueKind.FLOW),
            new OutputLookup(PUMPS, OutputObjectType.PUMP, ValueKind.FLOW),
            new OutputLookup(ORIFICES, OutputObjectType.ORIFICE, ValueKind.FLOW),
            new OutputLookup(WEIRS, OutputObjectType.WEIR, ValueKind.FLOW),
            new OutputLookup(CONDUITS, OutputObjectType.CONDUIT, ValueKind.FLOW));

    /**
     * {@code ElapsedTime} at index 0 followed by the named elements in the order given.
     *
     * @throws SelectionException if a name is not declared in any input-capable section
     */
    public List<InputSlot> selectInputs(SectionTable sections, List<String> names) {
        Objects.requireNonNull(sections, "sections");
        List<InputSlot> inputs = new ArrayList<>();
        inputs.add(InputSlot.elapsedTime());
        for (String raw : names == null ? List.<String>of() : names) {
            String name = raw.strip();
            InputObjectType type = INPUT_LOOKUP.stream()
                    .filter(lookup -> sections.names(lookup.section()).contains(name))
                    .map(InputLookup::objectType)
                    .findFirst()
                    .orElseThrow(() -> new SelectionException("Input element '" + name + "' not found in model"));
            inputs.add(new InputSlot(name, type, inputs.size()));
        }
        return inputs;
    }

    /**
     * @throws SelectionException if a name is not declared in any output-capable section
     */
    public List<OutputSlot> selectOutputs(SectionTable sections, List<String> names) {
        Objects.requireNonNull(sections, "sections");
        List<OutputSlot> outputs = new ArrayList<>();
        for (String raw : names == null ? List.<String>of() : names) {
            String name = raw.strip();
            OutputLookup lookup = OUTPUT_LOOKUP.stream()
                    .filter(candidate -> sections.names(candidate.section()).contains(name))
                    .findFirst()
                    .orElseThrow(() -> new SelectionException("Output element '" + name + "' not found in model"));
            outputs.add(new OutputSlot(name, lookup.objectType(), lookup.valueKind(), outputs.size()));
        }
        return outputs;
    }

    private record InputLookup(String section, InputObjectType objectType) {
    }

    private record OutputLookup(String section, OutputObjectType objectType, ValueKind valueKind) {
    }
}
