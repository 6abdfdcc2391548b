package ai.mathdoc.extractor.parse;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical categories of mathematical statements.
 */
public enum StatementType {
    DEFINITION,
    THEOREM,
    LEMMA,
    PROPOSITION,
    COROLLARY;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kinds that are expected to come with a proof.
     */
    public boolean expectsProof() {
        return this != DEFINITION;
    }

    public static Optional<StatementType> fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (StatementType type : values()) {
            if (type.key().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
