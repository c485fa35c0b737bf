package hydro.swmm.mapping.cli;

import hydro.swmm.mapping.config.Config;
import hydro.swmm.mapping.config.ConfigLoader;
import hydro.swmm.mapping.config.SystemEnvironmentReader;
import hydro.swmm.mapping.discovery.SelectionException;
import hydro.swmm.mapping.logging.LoggingConfigurator;
import hydro.swmm.mapping.mapping.MappingWriteException;
import hydro.swmm.mapping.mapping.MappingWriter;
import hydro.swmm.mapping.mapping.Staleness;
import hydro.swmm.mapping.mapping.StalenessChecker;
import hydro.swmm.mapping.parse.ParseException;
import hydro.swmm.mapping.service.GenerationRequest;
import hydro.swmm.mapping.service.GenerationResult;
import hydro.swmm.mapping.service.MappingGenerationService;
import hydro.swmm.mapping.service.ValidationFailedException;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and generation service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_STALE = 3;
    static final int EXIT_VALIDATION_FAILED = 4;

    private final ConfigLoader configLoader;
    private final MappingGenerationService generationService;
    private final StalenessChecker stalenessChecker;
    private PrintWriter out;
    private PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new MappingGenerationService(),
                new StalenessChecker(new MappingWriter()));
    }

    CliApplication(ConfigLoader configLoader, MappingGenerationService generationService, StalenessChecker stalenessChecker) {
        this.configLoader = configLoader;
        this.generationService = generationService;
        this.stalenessChecker = stalenessChecker;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    CliApplication withWriters(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
        return this;
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        if (out != null) {
            commandLine.setOut(out);
        }
        if (err != null) {
            commandLine.setErr(err);
        }
        PrintWriter stdout = commandLine.getOut();
        PrintWriter stderr = commandLine.getErr();

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            stderr.println(ex.getMessage());
            commandLine.usage(stderr);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(stdout);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(stdout);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            stderr.println("Error: " + ex.getMessage());
            commandLine.usage(stderr);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        MDC.put("model", config.modelFile().toString());
        try {
            return config.checkOnly() ? check(config, stdout) : generate(config, stdout, stderr);
        } catch (ParseException | SelectionException | MappingWriteException ex) {
            LOGGER.debug("Generation failed", ex);
            stderr.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } finally {
            MDC.remove("model");
            stdout.flush();
            stderr.flush();
        }
    }

    private int generate(Config config, PrintWriter stdout, PrintWriter stderr) {
        stdout.println("Processing: " + config.modelFile());
        GenerationRequest request = new GenerationRequest(config.modelFile(), config.outputFile(),
                config.inputSelections(), config.outputSelections(), !config.allowValidationErrors());
        try {
            GenerationResult result = generationService.generate(request);
            new SummaryPrinter(stdout).print(result);
            return EXIT_OK;
        } catch (ValidationFailedException ex) {
            SummaryPrinter.printValidation(stderr, ex.report());
            stderr.println("Error: " + ex.getMessage());
            stderr.println("Please fix the errors above, or rerun with --allow-errors");
            return EXIT_VALIDATION_FAILED;
        }
    }

    private int check(Config config, PrintWriter stdout) {
        Staleness staleness = stalenessChecker.check(config.modelFile(), config.outputFile());
        switch (staleness) {
            case FRESH -> stdout.println("Mapping " + config.outputFile() + " is up to date with " + config.modelFile());
            case STALE -> stdout.println("Mapping " + config.outputFile() + " is stale: regenerate it from " + config.modelFile());
            case MISSING -> stdout.println("Mapping " + config.outputFile() + " does not exist");
        }
        return staleness == Staleness.FRESH ? EXIT_OK : EXIT_STALE;
    }
}
