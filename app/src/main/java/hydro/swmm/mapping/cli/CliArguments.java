package hydro.swmm.mapping.cli;

import hydro.swmm.mapping.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "swmm-mapping", mixinStandardHelpOptions = true, version = "swmm-mapping 1.0",
        description = "Generates the solver bridge interface mapping from a SWMM .inp model")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "Path to the SWMM .inp file", paramLabel = "INP_FILE")
    private Path modelFile;

    @CommandLine.Option(names = {"-i", "--input"}, description = "Expose the named element as an input instead of discovering DUMMY references (repeatable)",
            paramLabel = "NAME")
    private List<String> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output"}, description = "Expose only the named elements as outputs (repeatable)", paramLabel = "NAME")
    private List<String> outputs = new ArrayList<>();

    @CommandLine.Option(names = {"-f", "--output-file"}, description = "Mapping file to write (default: SwmmGoldSimBridge.json)", paramLabel = "PATH")
    private Path outputFile;

    @CommandLine.Option(names = "--allow-errors", description = "Write the mapping even when validation reports errors")
    private boolean allowErrors;

    @CommandLine.Option(names = "--check", description = "Only report whether the existing mapping file matches the model")
    private boolean checkOnly;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public Path modelFile() {
        return modelFile;
    }

    public List<String> inputs() {
        return inputs;
    }

    public List<String> outputs() {
        return outputs;
    }

    public Path outputFile() {
        return outputFile;
    }

    public boolean allowErrors() {
        return allowErrors;
    }

    public boolean checkOnly() {
        return checkOnly;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
