package ai.mathdoc.extractor.parse;

import java.util.List;

/**
 * Tunables of a single extraction run.
 *
 * @param autoDetectEnvironments scan {@code \newtheorem} declarations before extracting
 * @param extraEnvironments statement environment names registered in addition to the built-in tables
 * @param labelLookahead characters after an opening marker searched for a label
 * @param minContentLength non-whitespace characters a statement or proof body needs to be kept
 */
public record ExtractionSettings(
        boolean autoDetectEnvironments,
        List<String> extraEnvironments,
        int labelLookahead,
        int minContentLength
) {

    public static final int DEFAULT_MIN_CONTENT_LENGTH = 3;

    public ExtractionSettings {
        extraEnvironments = extraEnvironments == null
                ? List.of()
                : extraEnvironments.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        if (labelLookahead < 1) {
            throw new IllegalArgumentException("labelLookahead must be at least 1");
        }
        if (minContentLength < 1) {
            throw new IllegalArgumentException("minContentLength must be at least 1");
        }
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(true, List.of(), LabelExtractor.DEFAULT_LOOKAHEAD, DEFAULT_MIN_CONTENT_LENGTH);
    }

    public ExtractionSettings withAutoDetect(boolean enabled) {
        return new ExtractionSettings(enabled, extraEnvironments, labelLookahead, minContentLength);
    }
}
