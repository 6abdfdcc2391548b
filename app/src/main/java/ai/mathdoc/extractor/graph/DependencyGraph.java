package ai.mathdoc.extractor.graph;

import ai.mathdoc.extractor.parse.StatementBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Label-to-block index plus the references of every block resolved against it.
 */
public final class DependencyGraph {

    private final int totalBlocks;
    private final Map<String, LabelTarget> labels;
    private final List<BlockDependencies> edges;

    private DependencyGraph(int totalBlocks, Map<String, LabelTarget> labels, List<BlockDependencies> edges) {
        this.totalBlocks = totalBlocks;
        this.labels = Collections.unmodifiableMap(labels);
        this.edges = List.copyOf(edges);
    }

    public static DependencyGraph build(List<StatementBlock> blocks) {
        List<StatementBlock> source = blocks == null ? List.of() : blocks;
        Map<String, LabelTarget> labels = new LinkedHashMap<>();
        for (int i = 0; i < source.size(); i++) {
            StatementBlock block = source.get(i);
            int index = i + 1;
            // a label defined twice points at its last definition
            block.label().ifPresent(label -> labels.put(label,
                    new LabelTarget(index, block.kind(), block.title())));
        }

        List<BlockDependencies> edges = new ArrayList<>();
        for (int i = 0; i < source.size(); i++) {
            StatementBlock block = source.get(i);
            if (block.referenceList().isEmpty()) {
                continue;
            }
            List<Dependency> dependencies = block.referenceList().stream()
                    .map(reference -> new Dependency(reference, Optional.ofNullable(labels.get(reference))))
                    .toList();
            edges.add(new BlockDependencies(i + 1, block, dependencies));
        }
        return new DependencyGraph(source.size(), labels, edges);
    }

    public int totalBlocks() {
        return totalBlocks;
    }

    public Map<String, LabelTarget> labels() {
        return labels;
    }

    public Optional<LabelTarget> resolve(String label) {
        return Optional.ofNullable(labels.get(label));
    }

    /**
     * Blocks with at least one reference, in document order.
     */
    public List<BlockDependencies> edges() {
        return edges;
    }

    public List<String> unresolvedReferences() {
        return edges.stream()
                .flatMap(edge -> edge.unresolved().stream())
                .map(Dependency::reference)
                .distinct()
                .toList();
    }
}
