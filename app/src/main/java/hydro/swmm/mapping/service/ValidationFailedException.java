package hydro.swmm.mapping.service;

import hydro.swmm.mapping.validate.ValidationReport;
import java.util.Objects;

/**
 * Raised when validation reports errors and the run is configured to abort on them.
 */
public class ValidationFailedException extends RuntimeException {

    private final ValidationReport report;

    public ValidationFailedException(ValidationReport report) {
        super("Model has " + report.errors().size() + " validation error(s); no mapping file was written");
        this.report = Objects.requireNonNull(report, "report");
    }

    public ValidationReport report() {
        return report;
    }
}
