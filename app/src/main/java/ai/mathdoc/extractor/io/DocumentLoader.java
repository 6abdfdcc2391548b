package ai.mathdoc.extractor.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads LaTeX source files from disk after checking that they exist and look like {@code .tex} files.
 */
public class DocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentLoader.class);
    private static final String TEX_EXTENSION = ".tex";

    private final boolean strictExtension;

    public DocumentLoader() {
        this(false);
    }

    /**
     * @param strictExtension reject files without a {@code .tex} extension instead of only warning
     */
    public DocumentLoader(boolean strictExtension) {
        this.strictExtension = strictExtension;
    }

    public String load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        if (!Files.exists(path)) {
            throw new DocumentLoadException(DocumentLoadException.Reason.NOT_FOUND, path, "File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new DocumentLoadException(DocumentLoadException.Reason.WRONG_KIND, path, "Not a regular file: " + path);
        }
        if (!hasTexExtension(path)) {
            if (strictExtension) {
                throw new DocumentLoadException(DocumentLoadException.Reason.WRONG_KIND, path,
                        "File must have a .tex extension: " + path);
            }
            LOGGER.warn("File {} does not have a .tex extension", path.getFileName());
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DocumentLoadException(DocumentLoadException.Reason.UNREADABLE, path,
                    "Failed to read document: " + path, ex);
        }
    }

    static boolean hasTexExtension(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(TEX_EXTENSION);
    }
}
