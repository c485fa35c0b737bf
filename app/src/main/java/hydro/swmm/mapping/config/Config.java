package hydro.swmm.mapping.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path modelFile,
        Path outputFile,
        List<String> inputSelections,
        List<String> outputSelections,
        boolean allowValidationErrors,
        boolean checkOnly,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(modelFile, "modelFile");
        Objects.requireNonNull(outputFile, "outputFile");
        inputSelections = normalizeSelections(inputSelections);
        outputSelections = normalizeSelections(outputSelections);
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (checkOnly && (!inputSelections.isEmpty() || !outputSelections.isEmpty())) {
            throw new IllegalArgumentException("--check cannot be combined with --input or --output");
        }
    }

    private static List<String> normalizeSelections(List<String> raw) {
        return raw == null
                ? List.of()
                : raw.stream()
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableList());
    }
}
