package hydro.swmm.mapping.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentFingerprintTest {

    private static final String MODEL = """
            [OPTIONS]
            FLOW_UNITS CFS
            [RAINGAGES]
            RG1 INTENSITY 0:15 1.0 TIMESERIES DUMMY
            """;

    @TempDir
    Path tempDir;

    @Test
    void producesLowerCaseMd5Hex() {
        String fingerprint = ContentFingerprint.of(MODEL);

        assertThat(fingerprint).hasSize(32).matches("[0-9a-f]{32}");
        assertThat(fingerprint).isEqualTo(ContentFingerprint.of(MODEL));
    }

    @Test
    void matchesDigestOfCanonicalText() {
        // md5("a b\nc")
        assertThat(ContentFingerprint.of("  a\t b \n\n; note\nc\n")).isEqualTo("4b858a399ea0d570a82bc4b86fe9ad6a");
    }

    @Test
    void ignoresBlankLinesCommentsAndWhitespaceRuns() {
        String reformatted = """

                ;; generated by editor
                [OPTIONS]
                   FLOW_UNITS        CFS


                [RAINGAGES]
                ; gage driven from outside
                RG1\tINTENSITY   0:15 1.0   TIMESERIES\tDUMMY
                """;

        assertThat(ContentFingerprint.of(reformatted)).isEqualTo(ContentFingerprint.of(MODEL));
    }

    @Test
    void changesWhenAnyTokenChanges() {
        String edited = MODEL.replace("0:15", "0:30");

        assertThat(ContentFingerprint.of(edited)).isNotEqualTo(ContentFingerprint.of(MODEL));
    }

    @Test
    void canonicalFormCollapsesWhitespace() {
        assertThat(ContentFingerprint.canonicalize("[A]\n  x    y  \n;c\n\nz"))
                .isEqualTo("[A]\nx y\nz");
    }

    @Test
    void fileAndStringFingerprintsAgree() throws Exception {
        Path model = tempDir.resolve("model.inp");
        Files.writeString(model, MODEL.replace("\n", "\r\n"), StandardCharsets.UTF_8);

        assertThat(ContentFingerprint.of(model)).isEqualTo(ContentFingerprint.of(MODEL));
    }
}
