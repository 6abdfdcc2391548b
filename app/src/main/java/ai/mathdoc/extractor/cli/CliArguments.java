package ai.mathdoc.extractor.cli;

import ai.mathdoc.extractor.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-mathdoc-extractor", mixinStandardHelpOptions = true, version = "ai-mathdoc-extractor 0.1.0",
        description = "Extracts definitions, theorems, lemmas, propositions and corollaries with their proofs from .tex files",
        footer = {
                "",
                "Examples:",
                "  ai-mathdoc-extractor document.tex",
                "  ai-mathdoc-extractor document.tex -o blocks.json --pretty",
                "  ai-mathdoc-extractor document.tex --stats --validate --deps"
        })
public class CliArguments {

    @CommandLine.Parameters(index = "0", description = "Input .tex file", paramLabel = "INPUT")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write the extracted blocks to this JSON file", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--stats", description = "Print detailed statistics")
    private boolean stats;

    @CommandLine.Option(names = "--validate", description = "Validate the extracted blocks")
    private boolean validate;

    @CommandLine.Option(names = "--deps", description = "Print the dependency graph between blocks")
    private boolean deps;

    @CommandLine.Option(names = "--pretty", description = "Indent the JSON output (only with -o)")
    private boolean pretty;

    @CommandLine.Option(names = "--no-auto-detect", description = "Disable detection of \\newtheorem environments")
    private boolean noAutoDetect;

    @CommandLine.Option(names = "--env", description = "Additional statement environment name (repeatable)", paramLabel = "NAME")
    private List<String> extraEnvironments = new ArrayList<>();

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log extraction details at debug level")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public boolean stats() {
        return stats;
    }

    public boolean validate() {
        return validate;
    }

    public boolean deps() {
        return deps;
    }

    public boolean pretty() {
        return pretty;
    }

    public boolean noAutoDetect() {
        return noAutoDetect;
    }

    public List<String> extraEnvironments() {
        return extraEnvironments == null ? List.of() : List.copyOf(extraEnvironments);
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
