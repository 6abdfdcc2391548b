package ai.mathdoc.extractor.parse;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes presentation-only commands and redundant whitespace from statement and proof bodies.
 * Mathematical content and structural environments are left as written.
 */
public final class ContentNormalizer {

    private static final List<Pattern> DROPPED_COMMANDS = List.of(
            Pattern.compile("\\\\vspace\\{[^}]+\\}"),
            Pattern.compile("\\\\hspace\\{[^}]+\\}"),
            Pattern.compile("\\\\newpage"),
            Pattern.compile("\\\\clearpage"),
            Pattern.compile("\\\\pagebreak"));

    private static final List<Pattern> UNWRAPPED_COMMANDS = List.of(
            Pattern.compile("\\\\textbf\\{([^}]+)\\}"),
            Pattern.compile("\\\\textit\\{([^}]+)\\}"),
            Pattern.compile("\\\\emph\\{([^}]+)\\}"));

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");

    public String normalize(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String result = content;
        for (Pattern pattern : DROPPED_COMMANDS) {
            result = pattern.matcher(result).replaceAll("");
        }
        for (Pattern pattern : UNWRAPPED_COMMANDS) {
            result = pattern.matcher(result).replaceAll("$1");
        }
        result = EXCESS_BLANK_LINES.matcher(result).replaceAll("\n\n");
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        return result.strip();
    }

    /**
     * Number of non-whitespace characters, the measure used for the minimum-content checks.
     */
    public static int significantLength(String content) {
        if (content == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < content.length(); i++) {
            if (!Character.isWhitespace(content.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
