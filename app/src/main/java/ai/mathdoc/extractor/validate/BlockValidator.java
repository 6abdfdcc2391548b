package ai.mathdoc.extractor.validate;

import ai.mathdoc.extractor.parse.StatementBlock;
import ai.mathdoc.extractor.parse.StatementType;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags extracted blocks that are likely to need attention before formalization.
 *
 * <p>Missing proofs of provable statements are reported as issues; missing formulas, very short
 * content and untitled theorems or propositions as warnings.
 */
public class BlockValidator {

    static final int MIN_RECOMMENDED_LENGTH = 20;
    private static final List<String> MATH_MARKERS = List.of("$", "\\[", "\\(", "\\begin{equation");

    public ValidationReport validate(List<StatementBlock> blocks) {
        List<ValidationFinding> issues = new ArrayList<>();
        List<ValidationFinding> warnings = new ArrayList<>();
        if (blocks == null) {
            return new ValidationReport(issues, warnings);
        }
        for (int i = 0; i < blocks.size(); i++) {
            StatementBlock block = blocks.get(i);
            int index = i + 1;
            String kind = block.kind().name();
            boolean expectsProof = block.kind().type().map(StatementType::expectsProof).orElse(false);
            if (expectsProof && !block.hasProof()) {
                issues.add(new ValidationFinding(FindingSeverity.ISSUE, index, kind, "missing proof"));
            }
            if (MATH_MARKERS.stream().noneMatch(block.content()::contains)) {
                warnings.add(new ValidationFinding(FindingSeverity.WARNING, index, kind, "no mathematical formulas"));
            }
            if (block.content().strip().length() < MIN_RECOMMENDED_LENGTH) {
                warnings.add(new ValidationFinding(FindingSeverity.WARNING, index, kind, "content is very short"));
            }
            if ((block.kind().is(StatementType.THEOREM) || block.kind().is(StatementType.PROPOSITION))
                    && block.title().isEmpty()) {
                warnings.add(new ValidationFinding(FindingSeverity.WARNING, index, kind, "missing title"));
            }
        }
        return new ValidationReport(issues, warnings);
    }
}
