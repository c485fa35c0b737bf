package hydro.swmm.mapping.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the bracket-sectioned, line-oriented model description format into a {@link SectionTable}.
 */
public class SectionParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionParser.class);

    static final String COMMENT_MARKER = ";";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    public SectionTable parse(Path file) {
        Objects.requireNonNull(file, "file");
        return parse(read(file));
    }

    public SectionTable parse(String content) {
        Objects.requireNonNull(content, "content");
        ParserState state = new ParserState();
        String[] lines = LINE_BREAK.split(content, -1);
        for (String rawLine : lines) {
            state.advance();
            consume(state, rawLine.strip());
        }
        SectionTable table = state.builder.build();
        LOGGER.debug("Parsed {} section(s) from {} line(s), discarded {} orphan line(s)",
                table.size(), state.lineNumber, state.orphanLines);
        return table;
    }

    /**
     * Reads a file as UTF-8, translating I/O problems into {@link ParseException}.
     */
    public static String read(Path file) {
        if (!Files.exists(file)) {
            throw new ParseException("File not found: " + file, new NoSuchFileException(file.toString()));
        }
        if (!Files.isRegularFile(file)) {
            throw new ParseException("Path is not a file: " + file, new IOException("Not a regular file: " + file));
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ParseException("Error reading file " + file + ": " + ex.getMessage(), ex);
        }
    }

    private void consume(ParserState state, String line) {
        if (line.isEmpty() || line.startsWith(COMMENT_MARKER)) {
            return;
        }

        if (line.startsWith("[")) {
            if (!line.endsWith("]")) {
                throw new ParseException(String.format("Malformed section header at line %d: '%s' - missing closing bracket ']'",
                        state.lineNumber, line), state.lineNumber);
            }
            String name = line.substring(1, line.length() - 1).strip();
            if (name.isEmpty()) {
                throw new ParseException(String.format("Empty section name at line %d: '%s'", state.lineNumber, line),
                        state.lineNumber);
            }
            if (name.indexOf('[') >= 0 || name.indexOf(']') >= 0) {
                throw unexpectedBracket(state, line);
            }
            state.open(name);
            return;
        }

        if (line.indexOf('[') >= 0 || line.indexOf(']') >= 0) {
            throw unexpectedBracket(state, line);
        }

        if (state.currentSection == null) {
            state.orphanLines++;
            return;
        }

        List<String> fields = Arrays.asList(WHITESPACE.split(line));
        state.builder.addRow(state.currentSection, fields);
    }

    private static ParseException unexpectedBracket(ParserState state, String line) {
        return new ParseException(String.format("Invalid syntax at line %d: '%s' - unexpected bracket character",
                state.lineNumber, line), state.lineNumber);
    }

    /**
     * Cursor carried through a single parsing pass.
     */
    private static final class ParserState {

        private final SectionTable.Builder builder = SectionTable.builder();
        private String currentSection;
        private int lineNumber;
        private int orphanLines;

        private void advance() {
            lineNumber++;
        }

        private void open(String name) {
            builder.openSection(name);
            currentSection = name;
        }
    }
}
