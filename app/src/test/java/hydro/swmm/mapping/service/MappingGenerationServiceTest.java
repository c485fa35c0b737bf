package hydro.swmm.mapping.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import hydro.swmm.mapping.discovery.SelectionException;
import hydro.swmm.mapping.fingerprint.ContentFingerprint;
import hydro.swmm.mapping.mapping.InterfaceDocument;
import hydro.swmm.mapping.parse.ParseException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MappingGenerationServiceTest {

    @TempDir
    Path tempDir;

    private final MappingGenerationService service = new MappingGenerationService();

    @Test
    void detentionPondProducesSentinelInputsAndExhaustiveOutputs() throws Exception {
        Path model = model("detention_pond.inp");
        Path output = tempDir.resolve("SwmmGoldSimBridge.json");

        GenerationResult result = service.generate(GenerationRequest.discover(model, output));

        InterfaceDocument document = result.document();
        assertThat(document.inputs())
                .extracting(InterfaceDocument.InputEntry::index, InterfaceDocument.InputEntry::name,
                        InterfaceDocument.InputEntry::objectType, InterfaceDocument.InputEntry::property)
                .containsExactly(
                        tuple(0, "ElapsedTime", "SYSTEM", "ELAPSEDTIME"),
                        tuple(1, "RG1", "GAGE", "RAINFALL"),
                        tuple(2, "P1", "PUMP", "SETTING"),
                        tuple(3, "OR1", "ORIFICE", "SETTING"),
                        tuple(4, "W1", "WEIR", "SETTING"),
                        tuple(5, "J1", "NODE", "LATFLOW"));
        assertThat(document.outputs())
                .extracting(InterfaceDocument.OutputEntry::name, InterfaceDocument.OutputEntry::objectType,
                        InterfaceDocument.OutputEntry::property)
                .containsExactly(
                        tuple("POND", "STORAGE", "VOLUME"),
                        tuple("OUT1", "OUTFALL", "FLOW"),
                        tuple("OR1", "ORIFICE", "FLOW"),
                        tuple("W1", "WEIR", "FLOW"),
                        tuple("S1", "SUBCATCH", "RUNOFF"),
                        tuple("S2", "SUBCATCH", "RUNOFF"));
        assertThat(document.contentFingerprint()).isEqualTo(ContentFingerprint.of(model));
        assertThat(result.validationReport().isClean()).isTrue();
        assertThat(result.discoveryWarnings()).isEmpty();
        assertThat(result.sectionRowCounts()).containsEntry("RAINGAGES", 2).containsEntry("DWF", 2);
        assertThat(output).exists();
    }

    @Test
    void regenerationIsByteIdentical() throws Exception {
        Path model = model("detention_pond.inp");
        Path output = tempDir.resolve("bridge.json");

        service.generate(GenerationRequest.discover(model, output));
        byte[] first = Files.readAllBytes(output);
        service.generate(GenerationRequest.discover(model, output));

        assertThat(Files.readAllBytes(output)).isEqualTo(first);
    }

    @Test
    void validationErrorsAbortWithoutWriting() throws Exception {
        Path output = tempDir.resolve("bridge.json");

        assertThatThrownBy(() -> service.generate(GenerationRequest.discover(model("broken_weir.inp"), output)))
                .isInstanceOfSatisfying(ValidationFailedException.class,
                        ex -> assertThat(ex.report().errors()).hasSize(1));
        assertThat(output).doesNotExist();
    }

    @Test
    void validationErrorsCanBeAllowed() throws Exception {
        Path output = tempDir.resolve("bridge.json");
        GenerationRequest request = new GenerationRequest(model("broken_weir.inp"), output, List.of(), List.of(), false);

        GenerationResult result = service.generate(request);

        assertThat(result.validationReport().hasErrors()).isTrue();
        assertThat(result.document().inputs()).extracting(InterfaceDocument.InputEntry::name)
                .containsExactly("ElapsedTime");
        assertThat(result.document().outputs()).extracting(InterfaceDocument.OutputEntry::name)
                .containsExactly("OUT1", "W1", "S1");
        assertThat(output).exists();
    }

    @Test
    void explicitSelectionsReplaceDiscovery() throws Exception {
        Path output = tempDir.resolve("bridge.json");
        GenerationRequest request = new GenerationRequest(model("detention_pond.inp"), output,
                List.of("RG2", "POND"), List.of("C1"), true);

        InterfaceDocument document = service.generate(request).document();

        assertThat(document.inputs())
                .extracting(InterfaceDocument.InputEntry::name, InterfaceDocument.InputEntry::objectType)
                .containsExactly(tuple("ElapsedTime", "SYSTEM"), tuple("RG2", "GAGE"), tuple("POND", "NODE"));
        assertThat(document.outputs())
                .extracting(InterfaceDocument.OutputEntry::name, InterfaceDocument.OutputEntry::objectType)
                .containsExactly(tuple("C1", "CONDUIT"));
    }

    @Test
    void unknownSelectionFailsWithoutWriting() throws Exception {
        Path output = tempDir.resolve("bridge.json");
        GenerationRequest request = new GenerationRequest(model("detention_pond.inp"), output,
                List.of("MISSING"), List.of(), true);

        assertThatThrownBy(() -> service.generate(request)).isInstanceOf(SelectionException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    void missingModelFailsAsParseError() {
        Path output = tempDir.resolve("bridge.json");

        assertThatThrownBy(() -> service.generate(GenerationRequest.discover(tempDir.resolve("none.inp"), output)))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("File not found");
    }

    @Test
    void malformedModelFailsBeforeWriting() throws Exception {
        Path model = tempDir.resolve("bad.inp");
        Files.writeString(model, "[JUNCTIONS\nJ1 95\n");
        Path output = tempDir.resolve("bridge.json");

        assertThatThrownBy(() -> service.generate(GenerationRequest.discover(model, output)))
                .isInstanceOf(ParseException.class);
        assertThat(output).doesNotExist();
    }

    private static Path model(String name) throws URISyntaxException {
        return Path.of(MappingGenerationServiceTest.class.getResource("/models/" + name).toURI());
    }
}
