package hydro.swmm.mapping.mapping;

import hydro.swmm.mapping.fingerprint.ContentFingerprint;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects whether an interface document still matches the model it was generated from.
 */
public class StalenessChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(StalenessChecker.class);

    private final MappingWriter mappingWriter;

    public StalenessChecker(MappingWriter mappingWriter) {
        this.mappingWriter = Objects.requireNonNull(mappingWriter, "mappingWriter");
    }

    public Staleness check(Path modelFile, Path documentFile) {
        Objects.requireNonNull(modelFile, "modelFile");
        Objects.requireNonNull(documentFile, "documentFile");
        if (!Files.exists(documentFile)) {
            return Staleness.MISSING;
        }
        String current = ContentFingerprint.of(modelFile);
        String recorded = mappingWriter.read(documentFile).contentFingerprint();
        if (current.equalsIgnoreCase(recorded)) {
            return Staleness.FRESH;
        }
        LOGGER.info("Mapping {} was generated from fingerprint {} but {} is now {}",
                documentFile, recorded, modelFile, current);
        return Staleness.STALE;
    }
}
