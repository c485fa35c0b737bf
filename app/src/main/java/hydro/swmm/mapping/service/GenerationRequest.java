package hydro.swmm.mapping.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One generation run: the model to read, where to write the document, and optional explicit selections.
 * Empty selections mean sentinel discovery for inputs and exhaustive discovery for outputs.
 */
public record GenerationRequest(Path modelFile,
                                Path outputFile,
                                List<String> inputSelections,
                                List<String> outputSelections,
                                boolean abortOnValidationErrors) {

    public GenerationRequest {
        Objects.requireNonNull(modelFile, "modelFile");
        Objects.requireNonNull(outputFile, "outputFile");
        inputSelections = List.copyOf(inputSelections == null ? List.of() : inputSelections);
        outputSelections = List.copyOf(outputSelections == null ? List.of() : outputSelections);
    }

    public static GenerationRequest discover(Path modelFile, Path outputFile) {
        return new GenerationRequest(modelFile, outputFile, List.of(), List.of(), true);
    }
}
