package ai.mathdoc.extractor.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code \label{...}} that may open a statement body.
 *
 * <p>The label must be the first non-whitespace token and must end inside a bounded lookahead window,
 * so a statement without a label never triggers a scan of the rest of the document.
 */
public final class LabelExtractor {

    public static final int DEFAULT_LOOKAHEAD = 200;

    private static final Pattern LABEL = Pattern.compile("\\s*\\\\label\\{([^}]+)\\}", Pattern.UNICODE_CHARACTER_CLASS);

    private final int lookahead;

    public LabelExtractor() {
        this(DEFAULT_LOOKAHEAD);
    }

    public LabelExtractor(int lookahead) {
        if (lookahead < 1) {
            throw new IllegalArgumentException("lookahead must be at least 1");
        }
        this.lookahead = lookahead;
    }

    public LabelMatch extract(String text, int position) {
        if (text == null || position < 0 || position >= text.length()) {
            return LabelMatch.none(Math.max(position, 0));
        }
        int windowEnd = (int) Math.min((long) position + lookahead, text.length());
        Matcher matcher = LABEL.matcher(text);
        matcher.region(position, windowEnd);
        if (!matcher.lookingAt()) {
            return LabelMatch.none(position);
        }
        String label = matcher.group(1).trim();
        if (label.isEmpty()) {
            return LabelMatch.none(position);
        }
        return new LabelMatch(Optional.of(label), matcher.end());
    }
}
