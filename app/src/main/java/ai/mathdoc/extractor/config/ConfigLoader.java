package ai.mathdoc.extractor.config;

import ai.mathdoc.extractor.cli.CliArguments;
import ai.mathdoc.extractor.parse.ExtractionSettings;
import ai.mathdoc.extractor.parse.LabelExtractor;
import ai.mathdoc.extractor.report.ReportSection;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_AUTO_DETECT = "EXTRACTOR_AUTO_DETECT";
    static final String ENV_EXTRA_ENVIRONMENTS = "EXTRACTOR_EXTRA_ENVIRONMENTS";
    static final String ENV_LABEL_LOOKAHEAD = "EXTRACTOR_LABEL_LOOKAHEAD";
    static final String ENV_MIN_CONTENT_LENGTH = "EXTRACTOR_MIN_CONTENT_LENGTH";
    static final String ENV_STRICT_EXTENSION = "EXTRACTOR_STRICT_EXTENSION";
    static final String ENV_VERBOSE = "EXTRACTOR_VERBOSE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.input() == null) {
            throw new IllegalArgumentException("input document must be provided");
        }
        boolean autoDetect = resolveAutoDetect(arguments);
        List<String> extraEnvironments = resolveExtraEnvironments(arguments);
        int labelLookahead = environmentReader.getNonBlank(ENV_LABEL_LOOKAHEAD)
                .map(value -> parsePositiveInteger(value, ENV_LABEL_LOOKAHEAD))
                .orElse(LabelExtractor.DEFAULT_LOOKAHEAD);
        int minContentLength = environmentReader.getNonBlank(ENV_MIN_CONTENT_LENGTH)
                .map(value -> parsePositiveInteger(value, ENV_MIN_CONTENT_LENGTH))
                .orElse(ExtractionSettings.DEFAULT_MIN_CONTENT_LENGTH);
        boolean strictExtension = environmentReader.getNonBlank(ENV_STRICT_EXTENSION)
                .map(ConfigLoader::parseFlag)
                .orElse(false);
        boolean verbose = arguments.verbose() || environmentReader.getNonBlank(ENV_VERBOSE)
                .map(ConfigLoader::parseFlag)
                .orElse(false);

        ExtractionSettings extraction = new ExtractionSettings(autoDetect, extraEnvironments, labelLookahead, minContentLength);
        return new Config(arguments.input(), Optional.ofNullable(arguments.output()), arguments.pretty(),
                resolveReportSections(arguments), extraction, strictExtension, resolveLogFormat(arguments), verbose);
    }

    private boolean resolveAutoDetect(CliArguments arguments) {
        if (arguments.noAutoDetect()) {
            return false;
        }
        return environmentReader.getNonBlank(ENV_AUTO_DETECT)
                .map(ConfigLoader::parseFlag)
                .orElse(true);
    }

    private List<String> resolveExtraEnvironments(CliArguments arguments) {
        Set<String> names = new LinkedHashSet<>(arguments.extraEnvironments());
        environmentReader.getNonBlank(ENV_EXTRA_ENVIRONMENTS)
                .map(ConfigLoader::parseList)
                .ifPresent(names::addAll);
        return List.copyOf(names);
    }

    private Set<ReportSection> resolveReportSections(CliArguments arguments) {
        Set<ReportSection> sections = EnumSet.noneOf(ReportSection.class);
        if (arguments.stats()) {
            sections.add(ReportSection.STATISTICS);
        }
        if (arguments.deps()) {
            sections.add(ReportSection.DEPENDENCIES);
        }
        if (arguments.validate()) {
            sections.add(ReportSection.VALIDATION);
        }
        return sections;
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static boolean parseFlag(String raw) {
        return raw.equalsIgnoreCase("true") || raw.equals("1");
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }
}
