package ai.mathdoc.extractor.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds statement environments a document declares itself through {@code \newtheorem}.
 */
public final class CustomEnvironmentDetector {

    private static final Pattern NEW_THEOREM = Pattern.compile(
            "\\\\newtheorem\\*?\\{([^}]+)\\}(?:\\[[^\\]]*\\])?\\{[^}]+\\}", Pattern.MULTILINE);
    private static final Pattern STYLED_NEW_THEOREM = Pattern.compile(
            "\\\\theoremstyle\\{[^}]+\\}\\s*\\\\newtheorem\\*?\\{([^}]+)\\}", Pattern.MULTILINE | Pattern.DOTALL);

    /**
     * Returns declared environment names that are not canonical kinds, in order of first appearance.
     * Plain declarations are collected before those introduced after a {@code \theoremstyle} directive.
     */
    public List<String> detect(String text) {
        List<String> names = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return names;
        }
        collect(NEW_THEOREM.matcher(text), names);
        collect(STYLED_NEW_THEOREM.matcher(text), names);
        return names;
    }

    private void collect(Matcher matcher, List<String> names) {
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (!name.isEmpty() && !EnvironmentRegistry.isCanonicalName(name) && !names.contains(name)) {
                names.add(name);
            }
        }
    }
}
