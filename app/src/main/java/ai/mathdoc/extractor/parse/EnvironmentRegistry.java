package ai.mathdoc.extractor.parse;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable set of recognized statement and proof environment names with the matchers compiled for them.
 *
 * <p>A registry is built once per document. Registering more names means building a new registry.
 */
public final class EnvironmentRegistry {

    static final List<String> CANONICAL_NAMES = List.of(
            StatementType.DEFINITION.key(),
            StatementType.THEOREM.key(),
            StatementType.LEMMA.key(),
            StatementType.PROPOSITION.key(),
            StatementType.COROLLARY.key());

    static final Map<String, StatementType> VARIANTS = variants();

    static final List<String> PROOF_NAMES = List.of("proof", "prueba", "demostracion", "demostración", "dem");

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final EnvironmentRegistry DEFAULTS = new EnvironmentRegistry(List.of());

    private final Set<String> environmentNames;
    private final Pattern statementPattern;
    private final Pattern proofStartPattern;
    private final Pattern proofEndPattern;

    private EnvironmentRegistry(Collection<String> extraNames) {
        Set<String> names = new LinkedHashSet<>(CANONICAL_NAMES);
        names.addAll(VARIANTS.keySet());
        for (String extra : extraNames) {
            if (extra != null && !extra.isBlank()) {
                names.add(extra.trim());
            }
        }
        this.environmentNames = Collections.unmodifiableSet(names);
        this.statementPattern = Pattern.compile(
                "\\\\begin\\{(" + alternation(names) + ")\\*?\\}(?:\\[([^\\]]*)\\])?", FLAGS);
        this.proofStartPattern = Pattern.compile("\\\\begin\\{(" + alternation(PROOF_NAMES) + ")\\*?\\}", FLAGS);
        this.proofEndPattern = Pattern.compile("\\\\end\\{(" + alternation(PROOF_NAMES) + ")\\*?\\}", FLAGS);
    }

    public static EnvironmentRegistry defaults() {
        return DEFAULTS;
    }

    public static EnvironmentRegistry withExtraNames(Collection<String> extraNames) {
        if (extraNames == null || extraNames.isEmpty()) {
            return DEFAULTS;
        }
        return new EnvironmentRegistry(extraNames);
    }

    public Set<String> environmentNames() {
        return environmentNames;
    }

    /**
     * Matches {@code \begin{name}} with an optional star and an optional {@code [title]}.
     * Group 1 is the environment name as written, group 2 the title.
     */
    public Pattern statementPattern() {
        return statementPattern;
    }

    public Pattern proofStartPattern() {
        return proofStartPattern;
    }

    public Pattern proofEndPattern() {
        return proofEndPattern;
    }

    public static boolean isCanonicalName(String name) {
        return name != null && CANONICAL_NAMES.contains(name);
    }

    /**
     * Maps a raw environment name to its statement kind.
     *
     * <p>Names outside the alias tables are classified by substring, checked in a fixed order
     * (theorem, definition, lemma, proposition, corollary). The first hit wins, so a name carrying
     * several fragments may be misclassified. Names with no hit stay unclassified.
     */
    public StatementKind normalizeEnvType(String rawName) {
        String lowered = rawName.toLowerCase(Locale.ROOT);
        String name = stripStars(lowered);
        if (name.isEmpty()) {
            // a name made only of stars has nothing left to classify
            return StatementKind.unclassified(lowered);
        }
        StatementType variant = VARIANTS.get(name);
        if (variant != null) {
            return StatementKind.of(variant);
        }
        if (CANONICAL_NAMES.contains(name)) {
            return StatementType.fromKey(name).map(StatementKind::of).orElseThrow();
        }
        if (name.contains("th") || name.contains("teo")) {
            return StatementKind.of(StatementType.THEOREM);
        } else if (name.contains("def")) {
            return StatementKind.of(StatementType.DEFINITION);
        } else if (name.contains("lem")) {
            return StatementKind.of(StatementType.LEMMA);
        } else if (name.contains("prop")) {
            return StatementKind.of(StatementType.PROPOSITION);
        } else if (name.contains("cor")) {
            return StatementKind.of(StatementType.COROLLARY);
        }
        return StatementKind.unclassified(name);
    }

    static String stripStars(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '*') {
            end--;
        }
        return name.substring(0, end);
    }

    private static String alternation(Collection<String> names) {
        // longest first, independent of insertion order
        return names.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
    }

    private static Map<String, StatementType> variants() {
        Map<String, StatementType> variants = new LinkedHashMap<>();
        variants.put("teorema", StatementType.THEOREM);
        variants.put("definicion", StatementType.DEFINITION);
        variants.put("definición", StatementType.DEFINITION);
        variants.put("lema", StatementType.LEMMA);
        variants.put("proposicion", StatementType.PROPOSITION);
        variants.put("proposición", StatementType.PROPOSITION);
        variants.put("corolario", StatementType.COROLLARY);
        variants.put("thm", StatementType.THEOREM);
        variants.put("defn", StatementType.DEFINITION);
        variants.put("def", StatementType.DEFINITION);
        variants.put("lem", StatementType.LEMMA);
        variants.put("prop", StatementType.PROPOSITION);
        variants.put("cor", StatementType.COROLLARY);
        variants.put("corol", StatementType.COROLLARY);
        return Collections.unmodifiableMap(variants);
    }
}
