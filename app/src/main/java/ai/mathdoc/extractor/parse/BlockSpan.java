package ai.mathdoc.extractor.parse;

import java.util.Objects;

/**
 * Raw body of an environment and the offset just past its closing marker.
 */
public record BlockSpan(String content, int endOffset) {

    public BlockSpan {
        Objects.requireNonNull(content, "content");
        if (endOffset < 0) {
            throw new IllegalArgumentException("endOffset must not be negative");
        }
    }
}
