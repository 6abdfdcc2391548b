package ai.mathdoc.extractor.config;

import ai.mathdoc.extractor.parse.ExtractionSettings;
import ai.mathdoc.extractor.report.ReportSection;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path input,
        Optional<Path> output,
        boolean prettyJson,
        Set<ReportSection> reportSections,
        ExtractionSettings extraction,
        boolean strictExtension,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(input, "input");
        output = output == null ? Optional.empty() : output;
        if (output.isPresent() && output.get().normalize().equals(input.normalize())) {
            throw new IllegalArgumentException("output must not overwrite the input document");
        }
        Objects.requireNonNull(extraction, "extraction");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        // the summary is the default report when nothing else is requested
        reportSections = reportSections == null || reportSections.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.of(ReportSection.SUMMARY))
                : Collections.unmodifiableSet(EnumSet.copyOf(reportSections));
    }

    public boolean reports(ReportSection section) {
        return reportSections.contains(section);
    }
}
