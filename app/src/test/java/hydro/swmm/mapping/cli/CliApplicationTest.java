package hydro.swmm.mapping.cli;

import static org.assertj.core.api.Assertions.assertThat;

import hydro.swmm.mapping.config.ConfigLoader;
import hydro.swmm.mapping.mapping.MappingWriter;
import hydro.swmm.mapping.mapping.StalenessChecker;
import hydro.swmm.mapping.service.MappingGenerationService;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private Path pond;
    private Path brokenWeir;
    private Path mapping;

    @BeforeEach
    void setUp() throws Exception {
        pond = copyModel("detention_pond.inp");
        brokenWeir = copyModel("broken_weir.inp");
        mapping = tempDir.resolve("SwmmGoldSimBridge.json");
    }

    @Test
    void generatesMappingAndPrintsSummary() {
        int exitCode = run(pond.toString(), "-f", mapping.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(mapping).exists();
        assertThat(out.toString())
                .contains("Processing: " + pond)
                .contains("No validation issues found")
                .contains("Discovered 6 input(s):")
                .contains("  [1] RG1 (GAGE/RAINFALL)")
                .contains("Successfully generated: " + mapping)
                .contains("Input count: 6")
                .contains("Output count: 6");
    }

    @Test
    void validationErrorsAbortWithDedicatedExitCode() {
        int exitCode = run(brokenWeir.toString(), "-f", mapping.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_VALIDATION_FAILED);
        assertThat(mapping).doesNotExist();
        assertThat(err.toString())
                .contains("ERROR: Weir 'W1' with RECT_OPEN has 3 parameters")
                .contains("Current line: W1 RECT_OPEN 2 10 0")
                .contains("--allow-errors");
    }

    @Test
    void allowErrorsWritesMappingAnyway() {
        int exitCode = run(brokenWeir.toString(), "-f", mapping.toString(), "--allow-errors");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(mapping).exists();
        assertThat(out.toString()).contains("CRITICAL ERRORS FOUND");
    }

    @Test
    void explicitSelectionsAreReported() {
        int exitCode = run(pond.toString(), "-f", mapping.toString(), "-i", "POND", "-o", "C1");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString())
                .contains("  [1] POND (NODE/LATFLOW)")
                .contains("  [0] C1 (CONDUIT/FLOW)");
    }

    @Test
    void unknownSelectionFails() {
        int exitCode = run(pond.toString(), "-f", mapping.toString(), "-o", "NOPE");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("Output element 'NOPE' not found in model");
        assertThat(mapping).doesNotExist();
    }

    @Test
    void missingModelFileFails() {
        int exitCode = run(tempDir.resolve("absent.inp").toString(), "-f", mapping.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("File not found");
    }

    @Test
    void malformedModelReportsLine() throws Exception {
        Path bad = tempDir.resolve("bad.inp");
        Files.writeString(bad, "[OPTIONS]\nFLOW_UNITS CFS\n[JUNCTIONS\n");

        int exitCode = run(bad.toString(), "-f", mapping.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("line 3");
    }

    @Test
    void checkReportsFreshStaleAndMissing() throws Exception {
        assertThat(run(pond.toString(), "-f", mapping.toString(), "--check")).isEqualTo(CliApplication.EXIT_STALE);
        assertThat(out.toString()).contains("does not exist");

        assertThat(run(pond.toString(), "-f", mapping.toString())).isEqualTo(CliApplication.EXIT_OK);
        assertThat(run(pond.toString(), "-f", mapping.toString(), "--check")).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString()).contains("is up to date");

        Files.writeString(pond, Files.readString(pond).replace("OUT1             90", "OUT1             89"));
        assertThat(run(pond.toString(), "-f", mapping.toString(), "--check")).isEqualTo(CliApplication.EXIT_STALE);
        assertThat(out.toString()).contains("is stale");
    }

    @Test
    void missingModelArgumentIsUsageError() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("model file must be provided").contains("Usage:");
    }

    @Test
    void unknownOptionIsUsageError() {
        assertThat(run(pond.toString(), "--bogus")).isEqualTo(2);
    }

    @Test
    void checkWithSelectionsIsUsageError() {
        assertThat(run(pond.toString(), "--check", "-i", "RG1")).isEqualTo(2);
        assertThat(err.toString()).contains("--check cannot be combined");
    }

    @Test
    void helpAndVersionExitCleanly() {
        assertThat(run("--help")).isZero();
        assertThat(out.toString()).contains("Usage: swmm-mapping");
        assertThat(run("--version")).isZero();
        assertThat(out.toString()).contains("swmm-mapping 1.0");
    }

    private int run(String... args) {
        CliApplication application = new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new MappingGenerationService(),
                new StalenessChecker(new MappingWriter()));
        return application.withWriters(new PrintWriter(out, true), new PrintWriter(err, true)).run(args);
    }

    private Path copyModel(String name) throws Exception {
        Path source = Path.of(CliApplicationTest.class.getResource("/models/" + name).toURI());
        return Files.copy(source, tempDir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
    }
}
