package hydro.swmm.mapping.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists interface documents as indented JSON and reads them back.
 * Writing always replaces whatever is at the target path.
 */
public class MappingWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MappingWriter.class);

    private final ObjectMapper objectMapper;

    public MappingWriter() {
        this(createObjectMapper());
    }

    MappingWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public void write(InterfaceDocument document, Path target) {
        if (document == null || target == null) {
            throw new IllegalArgumentException("document and target must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(document));
            LOGGER.debug("Wrote interface document with {} input(s) and {} output(s) to {}",
                    document.inputCount(), document.outputCount(), target);
        } catch (IOException ex) {
            throw new MappingWriteException("Failed to write mapping file: " + target, ex);
        }
    }

    public String toJson(InterfaceDocument document) {
        try {
            return objectMapper.writeValueAsString(document) + System.lineSeparator();
        } catch (IOException ex) {
            throw new MappingWriteException("Failed to serialize interface document", ex);
        }
    }

    public InterfaceDocument read(Path source) {
        Objects.requireNonNull(source, "source");
        if (!Files.isRegularFile(source)) {
            throw new MappingWriteException("Mapping file does not exist: " + source,
                    new NoSuchFileException(source.toString()));
        }
        try {
            return objectMapper.readValue(source.toFile(), InterfaceDocument.class);
        } catch (IOException ex) {
            throw new MappingWriteException("Failed to read mapping file: " + source, ex);
        }
    }
}
