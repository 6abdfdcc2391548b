package ai.mathdoc.extractor.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CommentStripperTest {

    private final CommentStripper stripper = new CommentStripper();

    @Test
    void removesCommentUpToLineBreak() {
        String stripped = stripper.strip("Sea $G$ un grupo % nota interna\ny $H$ un subgrupo");

        assertThat(stripped).isEqualTo("Sea $G$ un grupo \ny $H$ un subgrupo");
    }

    @Test
    void keepsEscapedPercentSign() {
        String stripped = stripper.strip("At least 50\\% of $n$ % hidden");

        assertThat(stripped).isEqualTo("At least 50\\% of $n$ ");
    }

    @Test
    void dropsWholeCommentLinesButKeepsTheirLineBreaks() {
        String stripped = stripper.strip("% header\n\\begin{lemma}\n%\\label{old}\nBody\n\\end{lemma}");

        assertThat(stripped).isEqualTo("\n\\begin{lemma}\n\nBody\n\\end{lemma}");
    }

    @Test
    void handlesNullAndEmptyInput() {
        assertThat(stripper.strip(null)).isEmpty();
        assertThat(stripper.strip("")).isEmpty();
    }
}
