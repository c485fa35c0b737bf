package hydro.swmm.mapping.parse;

import java.util.OptionalInt;

/**
 * Runtime exception raised when a model description file cannot be parsed.
 */
public class ParseException extends RuntimeException {

    private final int lineNumber;

    public ParseException(String message, int lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    /**
     * Line of the offending input, when the failure is tied to one.
     */
    public OptionalInt lineNumber() {
        return lineNumber > 0 ? OptionalInt.of(lineNumber) : OptionalInt.empty();
    }
}
