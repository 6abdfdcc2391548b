package ai.mathdoc.extractor.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * One reference of a block and the labelled block it resolves to, if any.
 */
public record Dependency(String reference, Optional<LabelTarget> target) {

    public Dependency {
        Objects.requireNonNull(reference, "reference");
        target = target == null ? Optional.empty() : target;
    }

    public boolean isResolved() {
        return target.isPresent();
    }
}
