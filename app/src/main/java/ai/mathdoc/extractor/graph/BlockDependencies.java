package ai.mathdoc.extractor.graph;

import ai.mathdoc.extractor.parse.StatementBlock;
import java.util.List;
import java.util.Objects;

/**
 * Outgoing references of a single block. The index is 1-based.
 */
public record BlockDependencies(int index, StatementBlock block, List<Dependency> dependencies) {

    public BlockDependencies {
        Objects.requireNonNull(block, "block");
        dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
    }

    public List<Dependency> unresolved() {
        return dependencies.stream().filter(dependency -> !dependency.isResolved()).toList();
    }
}
