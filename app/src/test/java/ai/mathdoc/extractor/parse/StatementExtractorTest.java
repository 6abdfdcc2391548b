package ai.mathdoc.extractor.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.mathdoc.extractor.io.DocumentLoadException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatementExtractorTest {

    @TempDir
    Path tempDir;

    private final StatementExtractor extractor = new StatementExtractor();

    @Test
    void extractsGroupTheoryDocumentInOrder() throws Exception {
        List<StatementBlock> blocks = extractor.extract(fixture());

        assertThat(blocks).extracting(block -> block.kind().name())
                .containsExactly("definition", "theorem", "lemma", "proposition");
        assertThat(blocks).extracting(StatementBlock::hasProof)
                .containsExactly(false, true, false, true);
        assertThat(blocks.get(0).title()).contains("Grupo");
        assertThat(blocks.get(1).title()).contains("Teorema de Lagrange");
        assertThat(blocks.get(2).title()).isEmpty();
        assertThat(blocks.get(3).title()).contains("Unicidad del Neutro");
    }

    @Test
    void capturesLabelsContentProofsAndReferences() throws Exception {
        List<StatementBlock> blocks = extractor.extract(fixture());

        StatementBlock definition = blocks.get(0);
        assertThat(definition.label()).contains("def:grupo");
        assertThat(definition.content())
                .startsWith("Un grupo es un par $(G, \\cdot)$")
                .contains("\\begin{enumerate}", "\\end{enumerate}")
                .doesNotContain("\\textbf", "\\label");
        assertThat(definition.references()).isEmpty();

        StatementBlock theorem = blocks.get(1);
        assertThat(theorem.label()).contains("thm:lagrange");
        assertThat(theorem.content()).startsWith("Sea $G$ un grupo finito").contains("$$|G| = |H| \\cdot [G:H]$$");
        assertThat(theorem.proof()).hasValueSatisfying(proof -> assertThat(proof)
                .startsWith("Sea $\\{g_1H")
                .endsWith("es el número de clases laterales."));
        assertThat(theorem.referenceList()).containsExactly("def:grupo");

        StatementBlock lemma = blocks.get(2);
        assertThat(lemma.label()).isEmpty();
        assertThat(lemma.content()).startsWith("Si $G$ es un grupo abeliano");
        assertThat(lemma.proof()).isEmpty();

        StatementBlock proposition = blocks.get(3);
        assertThat(proposition.proof()).hasValueSatisfying(proof -> assertThat(proof).startsWith("Supongamos que $e$"));
        assertThat(proposition.referenceList()).containsExactly("eq:orden");
    }

    @Test
    void neverLeaksCommentsOrLayoutCommands() throws Exception {
        List<StatementBlock> blocks = extractor.extract(fixture());

        assertThat(blocks).allSatisfy(block -> {
            assertThat(block.content()).doesNotContain("comentario", "\\vspace", "\\newpage");
            assertThat(block.proof().orElse("")).doesNotContain("demostración en el documento");
        });
    }

    @Test
    void producesIdenticalResultsForIdenticalInput() throws Exception {
        String text = fixture();

        assertThat(extractor.extract(text)).isEqualTo(extractor.extract(text));
    }

    @Test
    void commentsDoNotChangeTheResult() {
        String plain = "\\begin{theorem}\nAll $x$ hold.\n\\end{theorem}";
        String commented = "% header\n\\begin{theorem} % inline\nAll $x$ hold.\n\\end{theorem}\n% trailer";

        assertThat(extractor.extract(commented)).isEqualTo(extractor.extract(plain));
    }

    @Test
    void ignoresCommentedOutEnvironments() {
        List<StatementBlock> blocks = extractor.extract(
                "% \\begin{theorem}Hidden theorem\\end{theorem}\n\\begin{lemma}Visible lemma.\\end{lemma}");

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.kind().is(StatementType.LEMMA)).isTrue();
            assertThat(block.content()).isEqualTo("Visible lemma.");
        });
    }

    @Test
    void keepsEscapedPercentInContent() {
        List<StatementBlock> blocks = extractor.extract("\\begin{lemma}At least 50\\% of $n$.\\end{lemma}");

        assertThat(blocks).singleElement().extracting(StatementBlock::content).isEqualTo("At least 50\\% of $n$.");
    }

    @Test
    void capturesNestedEnvironmentOfTheSameKindAsOneBlock() {
        String text = """
                \\begin{theorem}[Outer]
                Outer start
                \\begin{theorem}
                Inner
                \\end{theorem}
                Outer end
                \\end{theorem}
                """;

        List<StatementBlock> blocks = extractor.extract(text);

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.title()).contains("Outer");
            assertThat(block.content()).isEqualTo("Outer start\n\\begin{theorem}\nInner\n\\end{theorem}\nOuter end");
        });
    }

    @Test
    void attachesOnlyAdjacentProofs() {
        String text = "\\begin{lemma}Lemma body.\\end{lemma}\nSome text.\n\\begin{proof}Orphan proof.\\end{proof}";

        List<StatementBlock> blocks = extractor.extract(text);

        assertThat(blocks).singleElement().satisfies(block -> assertThat(block.proof()).isEmpty());
    }

    @Test
    void skipsStatementsBelowMinimumContent() {
        List<StatementBlock> blocks = extractor.extract(
                "\\begin{theorem} a b \\end{theorem}\\begin{corollary}abc\\end{corollary}");

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.kind().is(StatementType.COROLLARY)).isTrue();
            assertThat(block.content()).isEqualTo("abc");
        });
    }

    @Test
    void dropsProofBelowMinimumContentAndKeepsStatement() {
        List<StatementBlock> blocks = extractor.extract(
                "\\begin{theorem}Statement.\\end{theorem}\\begin{proof}ok\\end{proof}\\begin{lemma}Next one.\\end{lemma}");

        assertThat(blocks).hasSize(2);
        assertThat(blocks.get(0).proof()).isEmpty();
        assertThat(blocks.get(1).content()).isEqualTo("Next one.");
    }

    @Test
    void deduplicatesReferencesAcrossStatementAndProof() {
        String text = "\\begin{theorem}By \\ref{a} and \\eqref{b}.\\end{theorem}\n"
                + "\\begin{proof}Use \\ref{a} then \\ref{c}.\\end{proof}";

        List<StatementBlock> blocks = extractor.extract(text);

        assertThat(blocks).singleElement().satisfies(block ->
                assertThat(block.referenceList()).containsExactly("a", "b", "c"));
    }

    @Test
    void treatsEmptyTitleAsAbsent() {
        List<StatementBlock> blocks = extractor.extract("\\begin{theorem}[ ]Body text.\\end{theorem}");

        assertThat(blocks).singleElement().satisfies(block -> assertThat(block.title()).isEmpty());
    }

    @Test
    void recognizesSpanishVariantsAndProofSynonyms() {
        String text = """
                \\begin{teorema}[Pitágoras]
                $a^2 + b^2 = c^2$
                \\end{teorema}
                \\begin{demostración}
                Obvia.
                \\end{demostración}
                """;

        List<StatementBlock> blocks = extractor.extract(text);

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.kind()).isEqualTo(StatementKind.of(StatementType.THEOREM));
            assertThat(block.title()).contains("Pitágoras");
            assertThat(block.proof()).contains("Obvia.");
        });
    }

    @Test
    void extractsDetectedCustomEnvironments() {
        String text = """
                \\newtheorem{axioma}{Axioma}
                \\newtheorem{mythm}{Theorem}
                \\begin{axioma}[Extensionalidad]
                Dos conjuntos son iguales si tienen los mismos elementos.
                \\end{axioma}
                \\begin{mythm}
                Every $x$ works.
                \\end{mythm}
                """;

        List<StatementBlock> blocks = extractor.extract(text);

        assertThat(blocks).hasSize(2);
        assertThat(blocks.get(0).kind().isClassified()).isFalse();
        assertThat(blocks.get(0).kind().name()).isEqualTo("axioma");
        assertThat(blocks.get(0).title()).contains("Extensionalidad");
        assertThat(blocks.get(1).kind().is(StatementType.THEOREM)).isTrue();
    }

    @Test
    void skipsCustomEnvironmentsWhenDetectionIsDisabled() {
        String text = "\\newtheorem{axioma}{Axioma}\n\\begin{axioma}Dos conjuntos.\\end{axioma}";

        StatementExtractor withoutDetection = new StatementExtractor(ExtractionSettings.defaults().withAutoDetect(false));

        assertThat(withoutDetection.extract(text)).isEmpty();
    }

    @Test
    void registersExtraEnvironmentsFromSettings() {
        ExtractionSettings settings = new ExtractionSettings(false, List.of("remark"), LabelExtractor.DEFAULT_LOOKAHEAD,
                ExtractionSettings.DEFAULT_MIN_CONTENT_LENGTH);

        List<StatementBlock> blocks = new StatementExtractor(settings).extract("\\begin{remark}A remark here.\\end{remark}");

        assertThat(blocks).singleElement().satisfies(block -> assertThat(block.kind().name()).isEqualTo("remark"));
    }

    @Test
    void mergesExtraAndDetectedEnvironmentNames() {
        ExtractionSettings settings = new ExtractionSettings(true, List.of("remark", "axioma"),
                LabelExtractor.DEFAULT_LOOKAHEAD, ExtractionSettings.DEFAULT_MIN_CONTENT_LENGTH);
        StatementExtractor custom = new StatementExtractor(settings);

        EnvironmentRegistry registry = custom.buildRegistry("\\newtheorem{axioma}{Axioma}\\newtheorem{nota}{Nota}");

        assertThat(registry.environmentNames()).contains("remark", "axioma", "nota", "theorem");
    }

    @Test
    void takesRestOfDocumentForUnclosedStatement() {
        List<StatementBlock> blocks = extractor.extract("\\begin{theorem}Never closed text");

        assertThat(blocks).singleElement().extracting(StatementBlock::content).isEqualTo("Never closed text");
    }

    @Test
    void leavesLabelInContentWhenBeyondLookahead() {
        ExtractionSettings settings = new ExtractionSettings(true, List.of(), 5, ExtractionSettings.DEFAULT_MIN_CONTENT_LENGTH);

        List<StatementBlock> blocks = new StatementExtractor(settings)
                .extract("\\begin{lemma}\n\n\n\n\n\n\\label{far}Body text\\end{lemma}");

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.label()).isEmpty();
            assertThat(block.content()).isEqualTo("\\label{far}Body text");
        });
    }

    @Test
    void returnsEmptyListWhenNothingMatches() {
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("Plain prose without environments.")).isEmpty();
    }

    @Test
    void keepsEnvironmentNamedOnlyWithStarsUnclassified() {
        List<StatementBlock> blocks = extractor.extract("\\newtheorem{*}{Star}\n\\begin{*}Some content here.\\end{*}");

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.kind().isClassified()).isFalse();
            assertThat(block.kind().name()).isEqualTo("*");
            assertThat(block.content()).isEqualTo("Some content here.");
        });
    }

    @Test
    void attachesProofAfterNonBreakingSpace() {
        List<StatementBlock> blocks = extractor.extract(
                "\\begin{theorem}Statement.\\end{theorem}\u00a0\\begin{proof}Short argument.\\end{proof}");

        assertThat(blocks).singleElement().satisfies(block -> assertThat(block.proof()).contains("Short argument."));
    }

    @Test
    void extractsBlocksFromFile() throws Exception {
        Path document = tempDir.resolve("notes.tex");
        Files.writeString(document, "\\begin{corollary}[Final]\nEvery $p$ divides.\n\\end{corollary}", StandardCharsets.UTF_8);

        List<StatementBlock> blocks = extractor.extractFile(document);

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.kind().is(StatementType.COROLLARY)).isTrue();
            assertThat(block.title()).contains("Final");
        });
    }

    @Test
    void reportsMissingFile() {
        Throwable thrown = catchThrowable(() -> extractor.extractFile(tempDir.resolve("missing.tex")));

        assertThat(thrown).isInstanceOf(DocumentLoadException.class);
        assertThat(((DocumentLoadException) thrown).reason()).isEqualTo(DocumentLoadException.Reason.NOT_FOUND);
    }

    private static String fixture() throws Exception {
        Path path = Path.of(StatementExtractorTest.class.getResource("/fixtures/group-theory.tex").toURI());
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
