package io.lineprofile.analyzer.cli;

import io.lineprofile.analyzer.config.Config;
import io.lineprofile.analyzer.config.ConfigLoader;
import io.lineprofile.analyzer.config.SystemEnvironmentReader;
import io.lineprofile.analyzer.image.ImageLoadException;
import io.lineprofile.analyzer.logging.LoggingConfigurator;
import io.lineprofile.analyzer.output.OutputWriteException;
import io.lineprofile.analyzer.pipeline.AnalysisRequest;
import io.lineprofile.analyzer.pipeline.AnalysisResult;
import io.lineprofile.analyzer.pipeline.LineProfileAnalyzer;
import io.lineprofile.analyzer.sample.CoordinateOutOfBoundsException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and analysis pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_ANALYSIS_FAILED = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, LineProfileAnalyzer> analyzerFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), LineProfileAnalyzer::fromConfig);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, LineProfileAnalyzer> analyzerFactory) {
        this.configLoader = configLoader;
        this.analyzerFactory = analyzerFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CliApplication().run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Analysing {} from {} to {} (output root {}, show={})",
                config.imagePath(), config.from(), config.to(), config.outputRoot(), config.show());

        LineProfileAnalyzer analyzer = analyzerFactory.apply(config);
        try {
            AnalysisResult result = analyzer.analyze(AnalysisRequest.from(config));
            LOGGER.info("Profile of {} samples written to {}", result.table().size(), result.outputDirectory());
            return 0;
        } catch (ImageLoadException | CoordinateOutOfBoundsException | OutputWriteException ex) {
            LOGGER.error("Analysis failed: {}", ex.getMessage(), ex);
            return EXIT_ANALYSIS_FAILED;
        }
    }
}
