package ai.mathdoc.extractor.cli;

import ai.mathdoc.extractor.config.Config;
import ai.mathdoc.extractor.config.ConfigLoader;
import ai.mathdoc.extractor.config.SystemEnvironmentReader;
import ai.mathdoc.extractor.export.BlockJsonSerializer;
import ai.mathdoc.extractor.graph.DependencyGraph;
import ai.mathdoc.extractor.io.DocumentLoadException;
import ai.mathdoc.extractor.io.DocumentLoader;
import ai.mathdoc.extractor.logging.LoggingConfigurator;
import ai.mathdoc.extractor.parse.StatementBlock;
import ai.mathdoc.extractor.parse.StatementExtractor;
import ai.mathdoc.extractor.report.ConsoleReportRenderer;
import ai.mathdoc.extractor.report.ExtractionStatistics;
import ai.mathdoc.extractor.report.ReportSection;
import ai.mathdoc.extractor.validate.BlockValidator;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, extractor and reports.
 */
public final class CliApplication {

    static final int EXIT_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), null, null);
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
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
            stderr.flush();
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Parsing {} (autoDetect={}, extraEnvironments={})", config.input(),
                config.extraction().autoDetectEnvironments(), config.extraction().extraEnvironments());

        StatementExtractor extractor = new StatementExtractor(config.extraction(), new DocumentLoader(config.strictExtension()));
        stdout.println("Parsing: " + config.input().getFileName());
        List<StatementBlock> blocks;
        try {
            blocks = extractor.extractFile(config.input());
        } catch (DocumentLoadException ex) {
            LOGGER.error("Failed to load {} ({}): {}", ex.path(), ex.reason(), ex.getMessage());
            stderr.println("Error: " + ex.getMessage());
            stderr.flush();
            return EXIT_FAILURE;
        }
        stdout.println("Completed: " + blocks.size() + " blocks extracted");
        stdout.flush();

        printReports(config, blocks, new ConsoleReportRenderer(stdout));

        if (config.output().isPresent()) {
            Path target = config.output().get();
            try {
                new BlockJsonSerializer(config.prettyJson()).write(blocks, target);
                stdout.println("JSON exported to: " + target);
                stdout.println("   Size: " + Files.size(target) + " bytes");
                stdout.flush();
            } catch (UncheckedIOException | IOException ex) {
                LOGGER.error("Failed to export JSON to {}", target, ex);
                stderr.println("Error: failed to export JSON: " + ex.getMessage());
                stderr.flush();
                return EXIT_FAILURE;
            }
        }
        return 0;
    }

    private void printReports(Config config, List<StatementBlock> blocks, ConsoleReportRenderer renderer) {
        if (config.reports(ReportSection.SUMMARY)) {
            renderer.renderSummary(blocks);
        }
        if (config.reports(ReportSection.STATISTICS)) {
            renderer.renderStatistics(ExtractionStatistics.from(blocks));
        }
        if (config.reports(ReportSection.DEPENDENCIES)) {
            renderer.renderDependencies(DependencyGraph.build(blocks));
        }
        if (config.reports(ReportSection.VALIDATION)) {
            renderer.renderValidation(new BlockValidator().validate(blocks), blocks.size());
        }
    }
}
