package ai.mathdoc.extractor.validate;

/**
 * Severity of a validation finding. Neither level fails an extraction.
 */
public enum FindingSeverity {
    ISSUE,
    WARNING
}
