package ai.mathdoc.extractor.report;

import ai.mathdoc.extractor.graph.BlockDependencies;
import ai.mathdoc.extractor.graph.Dependency;
import ai.mathdoc.extractor.graph.DependencyGraph;
import ai.mathdoc.extractor.graph.LabelTarget;
import ai.mathdoc.extractor.parse.StatementBlock;
import ai.mathdoc.extractor.validate.ValidationFinding;
import ai.mathdoc.extractor.validate.ValidationReport;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Prints human-readable reports about extracted blocks.
 */
public class ConsoleReportRenderer {

    static final int PREVIEW_LENGTH = 120;
    private static final String RULE = "=".repeat(80);

    private final PrintWriter out;

    public ConsoleReportRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void renderSummary(List<StatementBlock> blocks) {
        if (blocks.isEmpty()) {
            out.println("No mathematical blocks found in the document.");
            out.flush();
            return;
        }
        header("SUMMARY: " + blocks.size() + " blocks extracted");
        for (int i = 0; i < blocks.size(); i++) {
            StatementBlock block = blocks.get(i);
            StringBuilder line = new StringBuilder();
            line.append(i + 1).append(". ").append(kindLabel(block));
            block.title().ifPresent(title -> line.append(" [").append(title).append(']'));
            block.label().ifPresent(label -> line.append(" (label: ").append(label).append(')'));
            if (block.hasProof()) {
                line.append(" - with proof");
            }
            out.println(line);
            block.references().ifPresent(references -> out.println("   References: " + String.join(", ", references)));
            out.println("   " + preview(block.content()));
            out.println();
        }
        out.flush();
    }

    public void renderStatistics(ExtractionStatistics statistics) {
        if (statistics.totalBlocks() == 0) {
            out.println("No blocks to analyze.");
            out.flush();
            return;
        }
        header("STATISTICS");
        out.println("Total blocks: " + statistics.totalBlocks());
        out.println();
        out.println("Distribution by kind:");
        for (Map.Entry<String, Integer> entry : statistics.countsByKind().entrySet()) {
            out.println(String.format(Locale.ROOT, "  %-15s %3d (%5.1f%%)",
                    capitalize(entry.getKey()), entry.getValue(), percent(statistics.ratio(entry.getValue()))));
        }
        out.println();
        coverage("With title", statistics.withTitle(), statistics);
        coverage("With label", statistics.withLabel(), statistics);
        coverage("With proof", statistics.withProof(), statistics);
        coverage("With references", statistics.withReferences(), statistics);
        if (statistics.totalReferences() > 0) {
            out.println("Total references: " + statistics.totalReferences());
        }
        out.println();
        out.println(String.format(Locale.ROOT, "Average content length: %.0f characters", statistics.averageContentLength()));
        if (statistics.averageProofLength() > 0) {
            out.println(String.format(Locale.ROOT, "Average proof length: %.0f characters", statistics.averageProofLength()));
        }
        out.println();
        out.flush();
    }

    public void renderDependencies(DependencyGraph graph) {
        if (graph.totalBlocks() == 0) {
            out.println("No blocks to analyze.");
            out.flush();
            return;
        }
        header("DEPENDENCY GRAPH");
        out.println("Blocks with label: " + graph.labels().size() + "/" + graph.totalBlocks());
        out.println("Blocks with references: " + graph.edges().size() + "/" + graph.totalBlocks());
        out.println();
        if (graph.edges().isEmpty()) {
            out.println("No dependencies between blocks were found.");
            out.flush();
            return;
        }
        out.println("Detected dependencies:");
        out.println();
        for (BlockDependencies edge : graph.edges()) {
            StatementBlock block = edge.block();
            StringBuilder line = new StringBuilder();
            line.append(edge.index()).append(". ").append(kindLabel(block));
            block.title().ifPresent(title -> line.append(" [").append(title).append(']'));
            block.label().ifPresent(label -> line.append(" (").append(label).append(')'));
            out.println(line);
            out.println("   depends on:");
            for (Dependency dependency : edge.dependencies()) {
                if (dependency.isResolved()) {
                    LabelTarget target = dependency.target().get();
                    String title = target.title().map(value -> " [" + value + "]").orElse("");
                    out.println("      -> Block " + target.index() + ": " + target.kind().name().toUpperCase(Locale.ROOT) + title);
                } else {
                    out.println("      -> " + dependency.reference() + " (not found in document)");
                }
            }
            out.println();
        }
        out.flush();
    }

    public void renderValidation(ValidationReport report, int totalBlocks) {
        if (totalBlocks == 0) {
            out.println("No blocks to validate.");
            out.flush();
            return;
        }
        header("VALIDATION");
        if (report.isClean()) {
            out.println("All blocks passed validation");
        } else {
            findings("ISSUES FOUND", report.issues());
            findings("WARNINGS", report.warnings());
        }
        out.println();
        out.flush();
    }

    private void findings(String title, List<ValidationFinding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        out.println(title + " (" + findings.size() + "):");
        for (ValidationFinding finding : findings) {
            out.println("  - " + finding.describe());
        }
        out.println();
    }

    private void coverage(String label, int count, ExtractionStatistics statistics) {
        out.println(String.format(Locale.ROOT, "%s: %d/%d (%.1f%%)",
                label, count, statistics.totalBlocks(), percent(statistics.ratio(count))));
    }

    private void header(String title) {
        out.println();
        out.println(RULE);
        out.println(title);
        out.println(RULE);
        out.println();
    }

    static String preview(String content) {
        if (content.length() <= PREVIEW_LENGTH) {
            return content;
        }
        return content.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static String kindLabel(StatementBlock block) {
        return block.kind().name().toUpperCase(Locale.ROOT);
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    private static double percent(double ratio) {
        return ratio * 100.0;
    }
}
