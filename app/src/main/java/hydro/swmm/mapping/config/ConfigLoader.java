package hydro.swmm.mapping.config;

import hydro.swmm.mapping.cli.CliArguments;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_FILE = "MAPPING_OUTPUT_FILE";
    static final String ENV_ALLOW_ERRORS = "MAPPING_ALLOW_ERRORS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_OUTPUT_FILE = "SwmmGoldSimBridge.json";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path modelFile = Optional.ofNullable(arguments.modelFile())
                .orElseThrow(() -> new IllegalArgumentException("model file must be provided"));
        Path outputFile = Optional.ofNullable(arguments.outputFile())
                .or(() -> environmentReader.get(ENV_OUTPUT_FILE)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of))
                .orElse(Path.of(DEFAULT_OUTPUT_FILE));

        return new Config(modelFile,
                outputFile,
                arguments.inputs(),
                arguments.outputs(),
                resolveAllowErrors(arguments),
                arguments.checkOnly(),
                resolveLogFormat(arguments),
                arguments.verbose());
    }

    private boolean resolveAllowErrors(CliArguments arguments) {
        if (arguments.allowErrors()) {
            return true;
        }
        return environmentReader.get(ENV_ALLOW_ERRORS)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
