package hydro.swmm.mapping.validate;

import java.util.List;
import java.util.Objects;

/**
 * A single finding reported by {@link StructuralValidator}, with optional detail lines
 * such as the offending row and the expected format.
 */
public record ValidationIssue(Severity severity, String message, List<String> details) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ValidationIssue warning(String message) {
        return new ValidationIssue(Severity.WARNING, message, List.of());
    }

    public static ValidationIssue error(String message, String... details) {
        return new ValidationIssue(Severity.ERROR, message, List.of(details));
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
