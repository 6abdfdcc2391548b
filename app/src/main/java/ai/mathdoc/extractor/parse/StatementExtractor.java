package ai.mathdoc.extractor.parse;

import ai.mathdoc.extractor.io.DocumentLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts definitions, theorems, lemmas, propositions and corollaries with their proofs from LaTeX sources.
 *
 * <p>Each run strips comments, optionally detects custom {@code \newtheorem} environments, builds one
 * {@link EnvironmentRegistry} for the document and walks it. Malformed markup never fails a run; the
 * result is always a (possibly empty) list of blocks, and identical input yields identical output.
 */
public class StatementExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementExtractor.class);

    private final ExtractionSettings settings;
    private final DocumentLoader documentLoader;
    private final CommentStripper commentStripper = new CommentStripper();
    private final CustomEnvironmentDetector environmentDetector = new CustomEnvironmentDetector();

    public StatementExtractor() {
        this(ExtractionSettings.defaults(), new DocumentLoader());
    }

    public StatementExtractor(ExtractionSettings settings) {
        this(settings, new DocumentLoader());
    }

    public StatementExtractor(ExtractionSettings settings, DocumentLoader documentLoader) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.documentLoader = Objects.requireNonNull(documentLoader, "documentLoader");
    }

    public ExtractionSettings settings() {
        return settings;
    }

    public List<StatementBlock> extract(String text) {
        String source = commentStripper.strip(text);
        EnvironmentRegistry registry = buildRegistry(source);
        List<StatementBlock> blocks = new DocumentWalker(registry, settings).walk(source);
        LOGGER.debug("Extracted {} statement blocks from {} characters", blocks.size(), source.length());
        return blocks;
    }

    /**
     * Loads a {@code .tex} file and extracts its blocks.
     *
     * @throws ai.mathdoc.extractor.io.DocumentLoadException when the file is missing, of the wrong kind or unreadable
     */
    public List<StatementBlock> extractFile(Path path) {
        String text = documentLoader.load(path);
        List<StatementBlock> blocks = extract(text);
        LOGGER.info("Extracted {} statement blocks from {}", blocks.size(), path.getFileName());
        return blocks;
    }

    EnvironmentRegistry buildRegistry(String source) {
        List<String> names = new ArrayList<>(settings.extraEnvironments());
        if (settings.autoDetectEnvironments()) {
            List<String> detected = environmentDetector.detect(source);
            if (!detected.isEmpty()) {
                LOGGER.info("Detected custom environments: {}", String.join(", ", detected));
            }
            for (String name : detected) {
                if (!names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return EnvironmentRegistry.withExtraNames(names);
    }
}
