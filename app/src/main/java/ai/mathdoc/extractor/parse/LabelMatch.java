package ai.mathdoc.extractor.parse;

import java.util.Optional;

/**
 * Result of looking for a label right after an opening marker.
 */
public record LabelMatch(Optional<String> label, int contentStart) {

    public LabelMatch {
        label = label == null ? Optional.empty() : label;
        if (contentStart < 0) {
            throw new IllegalArgumentException("contentStart must not be negative");
        }
    }

    public static LabelMatch none(int position) {
        return new LabelMatch(Optional.empty(), position);
    }
}
