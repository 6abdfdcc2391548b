package ai.mathdoc.extractor.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A statement extracted from a document together with its label, title, proof and the labels it refers to.
 */
public record StatementBlock(
        StatementKind kind,
        Optional<String> label,
        Optional<String> title,
        String content,
        Optional<String> proof,
        Optional<List<String>> references
) {

    public StatementBlock {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
        label = label == null ? Optional.empty() : label;
        title = title == null ? Optional.empty() : title;
        proof = proof == null ? Optional.empty() : proof;
        references = references == null
                ? Optional.empty()
                : references.filter(values -> !values.isEmpty()).map(List::copyOf);
    }

    public boolean hasProof() {
        return proof.isPresent();
    }

    public List<String> referenceList() {
        return references.orElse(List.of());
    }
}
