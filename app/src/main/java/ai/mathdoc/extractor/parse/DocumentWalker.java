package ai.mathdoc.extractor.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a comment-free document front to back and collects its statement blocks.
 *
 * <p>For each opening marker the walker reads the label, the balanced body and an adjacent proof, then
 * resumes after whatever it consumed. The cursor never moves backwards, so every document is walked once.
 */
public final class DocumentWalker {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWalker.class);

    private final EnvironmentRegistry registry;
    private final LabelExtractor labelExtractor;
    private final BalancedBlockScanner blockScanner;
    private final ContentNormalizer normalizer;
    private final ReferenceExtractor referenceExtractor;
    private final ProofAssociator proofAssociator;
    private final int minContentLength;

    public DocumentWalker(EnvironmentRegistry registry, ExtractionSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(settings, "settings");
        this.labelExtractor = new LabelExtractor(settings.labelLookahead());
        this.blockScanner = new BalancedBlockScanner();
        this.normalizer = new ContentNormalizer();
        this.referenceExtractor = new ReferenceExtractor();
        this.proofAssociator = new ProofAssociator(registry);
        this.minContentLength = settings.minContentLength();
    }

    public List<StatementBlock> walk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<StatementBlock> blocks = new ArrayList<>();
        Matcher opening = registry.statementPattern().matcher(text);
        int position = 0;
        while (position < text.length() && opening.find(position)) {
            String rawName = opening.group(1);
            StatementKind kind = registry.normalizeEnvType(rawName);
            Optional<String> title = Optional.ofNullable(opening.group(2))
                    .map(String::strip)
                    .filter(value -> !value.isEmpty());
            if (!kind.isClassified()) {
                LOGGER.debug("Environment '{}' matches no known statement kind; keeping it unclassified", rawName);
            }

            LabelMatch labelMatch = labelExtractor.extract(text, opening.end());
            BlockSpan body = blockScanner.scan(text, labelMatch.contentStart(), rawName);
            String content = normalizer.normalize(body.content());
            if (!meetsMinimum(content)) {
                LOGGER.debug("Skipping {} at offset {}: content below {} characters", kind, opening.start(), minContentLength);
                position = body.endOffset();
                continue;
            }

            List<String> references = referenceExtractor.extract(body.content());
            Optional<String> proof = Optional.empty();
            int next = body.endOffset();
            Optional<BlockSpan> proofSpan = proofAssociator.associate(text, body.endOffset());
            if (proofSpan.isPresent()) {
                String proofContent = normalizer.normalize(proofSpan.get().content());
                if (meetsMinimum(proofContent)) {
                    proof = Optional.of(proofContent);
                    references = ReferenceExtractor.merge(references, referenceExtractor.extract(proofSpan.get().content()));
                    next = proofSpan.get().endOffset();
                } else {
                    LOGGER.debug("Dropping proof of {} at offset {}: content below {} characters", kind, opening.start(), minContentLength);
                }
            }

            blocks.add(new StatementBlock(kind, labelMatch.label(), title, content, proof,
                    references.isEmpty() ? Optional.empty() : Optional.of(references)));
            position = next;
        }
        return Collections.unmodifiableList(blocks);
    }

    private boolean meetsMinimum(String content) {
        return ContentNormalizer.significantLength(content) >= minContentLength;
    }
}
