package ai.mathdoc.extractor.parse;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the labels a piece of text points at through {@code \ref} and {@code \eqref}.
 */
public final class ReferenceExtractor {

    private static final Pattern REFERENCE = Pattern.compile("\\\\(?:eq)?ref\\{([^}]+)\\}");

    /**
     * Returns referenced labels without duplicates, in the order they first appear.
     */
    public List<String> extract(String text) {
        Set<String> references = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            String reference = matcher.group(1).trim();
            if (!reference.isEmpty()) {
                references.add(reference);
            }
        }
        return List.copyOf(references);
    }

    /**
     * Appends references of {@code second} that {@code first} does not already contain.
     */
    public static List<String> merge(List<String> first, List<String> second) {
        Set<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }
}
