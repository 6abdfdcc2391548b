package ai.mathdoc.extractor.validate;

import java.util.List;
import java.util.Objects;

public record ValidationReport(List<ValidationFinding> issues, List<ValidationFinding> warnings) {

    public ValidationReport {
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }

    public boolean isClean() {
        return issues.isEmpty() && warnings.isEmpty();
    }
}
