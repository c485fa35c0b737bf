package hydro.swmm.mapping.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import hydro.swmm.mapping.parse.SectionParser;
import hydro.swmm.mapping.parse.SectionTable;
import java.util.List;
import org.junit.jupiter.api.Test;

class SlotSelectorTest {

    private static final SectionTable MODEL = new SectionParser().parse("""
            [RAINGAGES]
            RG1 INTENSITY 0:15 1.0 TIMESERIES TS1
            [SUBCATCHMENTS]
            S1 RG1 J1 10
            [JUNCTIONS]
            J1 95
            [STORAGE]
            POND 100
            [OUTFALLS]
            OUT1 90 FREE
            [CONDUITS]
            C1 J1 OUT1 100
            [PUMPS]
            P1 POND J1 CURVE1
            [ORIFICES]
            OR1 POND J1 BOTTOM
            [WEIRS]
            W1 POND OUT1 TRANSVERSE
            """);

    private final SlotSelector selector = new SlotSelector();

    @Test
    void selectedInputsFollowElapsedTimeInCallerOrder() {
        List<InputSlot> inputs = selector.selectInputs(MODEL, List.of("POND", "W1", "RG1", " J1 "));

        assertThat(inputs)
                .extracting(InputSlot::name, InputSlot::objectType, InputSlot::index)
                .containsExactly(
                        tuple("ElapsedTime", InputObjectType.SYSTEM, 0),
                        tuple("POND", InputObjectType.NODE, 1),
                        tuple("W1", InputObjectType.WEIR, 2),
                        tuple("RG1", InputObjectType.GAGE, 3),
                        tuple("J1", InputObjectType.NODE, 4));
    }

    @Test
    void noSelectedInputsLeavesOnlyElapsedTime() {
        assertThat(selector.selectInputs(MODEL, null)).containsExactly(InputSlot.elapsedTime());
        assertThat(selector.selectInputs(MODEL, List.of())).containsExactly(InputSlot.elapsedTime());
    }

    @Test
    void selectedOutputsTakeCategoryFromDeclaringSection() {
        List<OutputSlot> outputs = selector.selectOutputs(MODEL, List.of("C1", "J1", "S1", "P1", "OUT1", "POND"));

        assertThat(outputs)
                .extracting(OutputSlot::name, OutputSlot::objectType, OutputSlot::valueKind, OutputSlot::index)
                .containsExactly(
                        tuple("C1", OutputObjectType.CONDUIT, ValueKind.FLOW, 0),
                        tuple("J1", OutputObjectType.JUNCTION, ValueKind.INFLOW, 1),
                        tuple("S1", OutputObjectType.SUBCATCH, ValueKind.RUNOFF, 2),
                        tuple("P1", OutputObjectType.PUMP, ValueKind.FLOW, 3),
                        tuple("OUT1", OutputObjectType.OUTFALL, ValueKind.FLOW, 4),
                        tuple("POND", OutputObjectType.STORAGE, ValueKind.VOLUME, 5));
    }

    @Test
    void unknownInputNameIsRejected() {
        assertThatThrownBy(() -> selector.selectInputs(MODEL, List.of("RG1", "NOPE")))
                .isInstanceOf(SelectionException.class)
                .hasMessage("Input element 'NOPE' not found in model");
    }

    @Test
    void outfallIsNotAnInputCandidate() {
        assertThatThrownBy(() -> selector.selectInputs(MODEL, List.of("OUT1")))
                .isInstanceOf(SelectionException.class)
                .hasMessageContaining("OUT1");
    }

    @Test
    void unknownOutputNameIsRejected() {
        assertThatThrownBy(() -> selector.selectOutputs(MODEL, List.of("RG1")))
                .isInstanceOf(SelectionException.class)
                .hasMessage("Output element 'RG1' not found in model");
    }
}
