package hydro.swmm.mapping.validate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of validation issues for one model.
 */
public record ValidationReport(List<ValidationIssue> issues) {

    public ValidationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(ValidationIssue::isError);
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).collect(Collectors.toList());
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> !issue.isError()).collect(Collectors.toList());
    }
}
