package hydro.swmm.mapping.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Declarative contract between a model and the solver bridge, serialized with the field names the bridge reads.
 */
@JsonPropertyOrder({"version", "inp_file_hash", "input_count", "output_count", "inputs", "outputs"})
public record InterfaceDocument(
        @JsonProperty("version") String version,
        @JsonProperty("inp_file_hash") String contentFingerprint,
        @JsonProperty("input_count") int inputCount,
        @JsonProperty("output_count") int outputCount,
        @JsonProperty("inputs") List<InputEntry> inputs,
        @JsonProperty("outputs") List<OutputEntry> outputs
) {

    public static final String CURRENT_VERSION = "1.0";

    public InterfaceDocument {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(contentFingerprint, "contentFingerprint");
        inputs = List.copyOf(inputs == null ? List.of() : inputs);
        outputs = List.copyOf(outputs == null ? List.of() : outputs);
        if (inputCount != inputs.size()) {
            throw new IllegalArgumentException("input_count " + inputCount + " does not match " + inputs.size() + " inputs");
        }
        if (outputCount != outputs.size()) {
            throw new IllegalArgumentException("output_count " + outputCount + " does not match " + outputs.size() + " outputs");
        }
    }

    @JsonPropertyOrder({"index", "name", "object_type", "property"})
    public record InputEntry(
            @JsonProperty("index") int index,
            @JsonProperty("name") String name,
            @JsonProperty("object_type") String objectType,
            @JsonProperty("property") String property
    ) {
    }

    /**
     * {@code engineIndex} is resolved by the bridge at run time; the generator always writes 0.
     */
    @JsonPropertyOrder({"index", "name", "object_type", "property", "swmm_index"})
    public record OutputEntry(
            @JsonProperty("index") int index,
            @JsonProperty("name") String name,
            @JsonProperty("object_type") String objectType,
            @JsonProperty("property") String property,
            @JsonProperty("swmm_index") int engineIndex
    ) {
    }
}
