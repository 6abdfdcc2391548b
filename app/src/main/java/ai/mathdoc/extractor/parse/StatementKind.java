package ai.mathdoc.extractor.parse;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized kind of an extracted statement. Either one of the canonical {@link StatementType}s
 * or an unclassified custom environment name.
 */
public record StatementKind(String name, Optional<StatementType> type) {

    public StatementKind {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        type = type == null ? Optional.empty() : type;
        if (type.isPresent() && !type.get().key().equals(name)) {
            throw new IllegalArgumentException("name must match the canonical key of " + type.get());
        }
    }

    public static StatementKind of(StatementType type) {
        Objects.requireNonNull(type, "type");
        return new StatementKind(type.key(), Optional.of(type));
    }

    public static StatementKind unclassified(String rawName) {
        return new StatementKind(rawName.toLowerCase(Locale.ROOT), Optional.empty());
    }

    public boolean isClassified() {
        return type.isPresent();
    }

    public boolean is(StatementType candidate) {
        return type.filter(value -> value == candidate).isPresent();
    }

    @Override
    public String toString() {
        return name;
    }
}
