package hydro.swmm.mapping.service;

import hydro.swmm.mapping.mapping.InterfaceDocument;
import hydro.swmm.mapping.validate.ValidationReport;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a successful generation run.
 *
 * @param sectionRowCounts rows per parsed section, in file order
 */
public record GenerationResult(InterfaceDocument document,
                               ValidationReport validationReport,
                               List<String> discoveryWarnings,
                               Map<String, Integer> sectionRowCounts,
                               Path outputFile) {

    public GenerationResult {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(validationReport, "validationReport");
        Objects.requireNonNull(outputFile, "outputFile");
        discoveryWarnings = List.copyOf(discoveryWarnings == null ? List.of() : discoveryWarnings);
        sectionRowCounts = sectionRowCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sectionRowCounts));
    }
}
