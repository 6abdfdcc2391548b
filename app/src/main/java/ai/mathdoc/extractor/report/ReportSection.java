package ai.mathdoc.extractor.report;

/**
 * Console reports the CLI can print after an extraction.
 */
public enum ReportSection {
    SUMMARY,
    STATISTICS,
    DEPENDENCIES,
    VALIDATION
}
