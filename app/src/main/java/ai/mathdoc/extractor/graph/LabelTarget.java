package ai.mathdoc.extractor.graph;

import ai.mathdoc.extractor.parse.StatementKind;
import java.util.Objects;
import java.util.Optional;

/**
 * A labelled block a reference can point to. The index is 1-based.
 */
public record LabelTarget(int index, StatementKind kind, Optional<String> title) {

    public LabelTarget {
        if (index < 1) {
            throw new IllegalArgumentException("index must be 1-based");
        }
        Objects.requireNonNull(kind, "kind");
        title = title == null ? Optional.empty() : title;
    }
}
