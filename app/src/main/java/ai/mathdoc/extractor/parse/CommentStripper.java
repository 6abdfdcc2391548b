package ai.mathdoc.extractor.parse;

/**
 * Removes {@code %} line comments. An escaped {@code \%} is kept as text; line breaks are preserved.
 */
public final class CommentStripper {

    private static final char COMMENT = '%';
    private static final char ESCAPE = '\\';

    public String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int n = text.length();
        StringBuilder builder = new StringBuilder(n);
        boolean inComment = false;
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                inComment = false;
                builder.append(c);
                continue;
            }
            if (inComment) {
                continue;
            }
            if (c == COMMENT && (i == 0 || text.charAt(i - 1) != ESCAPE)) {
                inComment = true;
                continue;
            }
            builder.append(c);
        }
        return builder.toString();
    }
}
