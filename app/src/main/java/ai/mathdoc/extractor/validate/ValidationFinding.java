package ai.mathdoc.extractor.validate;

import java.util.Objects;

/**
 * A single advisory finding about block {@code index} (1-based).
 */
public record ValidationFinding(FindingSeverity severity, int index, String kind, String message) {

    public ValidationFinding {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public String describe() {
        return "Block " + index + " (" + kind + "): " + message;
    }
}
