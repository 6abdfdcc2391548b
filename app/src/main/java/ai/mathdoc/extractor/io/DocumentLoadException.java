package ai.mathdoc.extractor.io;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Runtime exception raised when a source document cannot be loaded.
 */
public class DocumentLoadException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        WRONG_KIND,
        UNREADABLE
    }

    private final Reason reason;
    private final Path path;

    public DocumentLoadException(Reason reason, Path path, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.path = path;
    }

    public DocumentLoadException(Reason reason, Path path, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.path = path;
    }

    public Reason reason() {
        return reason;
    }

    public Path path() {
        return path;
    }
}
