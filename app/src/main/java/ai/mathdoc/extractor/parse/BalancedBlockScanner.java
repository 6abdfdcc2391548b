package ai.mathdoc.extractor.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the {@code \end} that closes an environment, balancing nested environments of the same name.
 *
 * <p>Only markers for the exact environment name (starred or not) count towards the nesting depth.
 * An environment that is never closed extends to the end of the text.
 */
public final class BalancedBlockScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BalancedBlockScanner.class);

    /**
     * @param text full document text
     * @param start offset where the environment body begins
     * @param rawName environment name exactly as written in the opening marker
     * @return the body up to the matching closing marker and the offset just past that marker
     */
    public BlockSpan scan(String text, int start, String rawName) {
        Matcher matcher = markerPattern(rawName).matcher(text);
        int depth = 1;
        int position = start;
        while (position <= text.length() && matcher.find(position)) {
            if (matcher.group(1).equalsIgnoreCase("begin")) {
                depth++;
            } else {
                depth--;
            }
            if (depth == 0) {
                return new BlockSpan(text.substring(start, matcher.start()), matcher.end());
            }
            position = matcher.end();
        }
        LOGGER.debug("Environment '{}' opened before offset {} is never closed; taking the rest of the document",
                rawName, start);
        return new BlockSpan(text.substring(start), text.length());
    }

    private static Pattern markerPattern(String rawName) {
        return Pattern.compile("\\\\(begin|end)\\{" + Pattern.quote(EnvironmentRegistry.stripStars(rawName)) + "\\*?\\}",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
