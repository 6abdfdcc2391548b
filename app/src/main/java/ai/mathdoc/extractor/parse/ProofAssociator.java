package ai.mathdoc.extractor.parse;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs a statement with the proof environment that directly follows it.
 *
 * <p>Only whitespace may separate the statement's closing marker from the proof's opening marker.
 * All proof synonyms share one nesting depth, so {@code \begin{prueba}} may be closed by {@code \end{proof}}.
 */
public final class ProofAssociator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProofAssociator.class);

    private final EnvironmentRegistry registry;

    public ProofAssociator(EnvironmentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @param text full document text
     * @param position offset just past the statement's closing marker
     * @return the raw proof body and the offset past its closing marker, or empty when no adjacent proof exists
     */
    public Optional<BlockSpan> associate(String text, int position) {
        int candidate = skipWhitespace(text, position);
        if (candidate >= text.length()) {
            return Optional.empty();
        }
        Matcher opening = registry.proofStartPattern().matcher(text);
        opening.region(candidate, text.length());
        if (!opening.lookingAt()) {
            return Optional.empty();
        }

        int contentStart = opening.end();
        Matcher begin = registry.proofStartPattern().matcher(text);
        Matcher end = registry.proofEndPattern().matcher(text);
        int depth = 1;
        int cursor = contentStart;
        while (cursor <= text.length()) {
            boolean hasBegin = begin.find(cursor);
            boolean hasEnd = end.find(cursor);
            if (!hasBegin && !hasEnd) {
                break;
            }
            if (hasBegin && (!hasEnd || begin.start() < end.start())) {
                depth++;
                cursor = begin.end();
                continue;
            }
            depth--;
            if (depth == 0) {
                return Optional.of(new BlockSpan(text.substring(contentStart, end.start()), end.end()));
            }
            cursor = end.end();
        }
        LOGGER.debug("Proof opened at offset {} is never closed; taking the rest of the document", candidate);
        return Optional.of(new BlockSpan(text.substring(contentStart), text.length()));
    }

    private static int skipWhitespace(String text, int position) {
        int index = Math.max(position, 0);
        while (index < text.length() && isBlank(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
