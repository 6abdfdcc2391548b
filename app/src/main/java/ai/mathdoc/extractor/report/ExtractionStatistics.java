package ai.mathdoc.extractor.report;

import ai.mathdoc.extractor.parse.StatementBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate figures over an extraction result.
 */
public record ExtractionStatistics(
        int totalBlocks,
        Map<String, Integer> countsByKind,
        int withTitle,
        int withLabel,
        int withProof,
        int withReferences,
        int totalReferences,
        double averageContentLength,
        double averageProofLength
) {

    public ExtractionStatistics {
        Objects.requireNonNull(countsByKind, "countsByKind");
        countsByKind = Collections.unmodifiableMap(new LinkedHashMap<>(countsByKind));
    }

    /**
     * Computes statistics; kinds are ordered by descending count, ties by first appearance.
     */
    public static ExtractionStatistics from(List<StatementBlock> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return new ExtractionStatistics(0, Map.of(), 0, 0, 0, 0, 0, 0.0, 0.0);
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        int withTitle = 0;
        int withLabel = 0;
        int withProof = 0;
        int withReferences = 0;
        int totalReferences = 0;
        long contentLength = 0;
        long proofLength = 0;
        for (StatementBlock block : blocks) {
            counts.merge(block.kind().name(), 1, Integer::sum);
            if (block.title().isPresent()) {
                withTitle++;
            }
            if (block.label().isPresent()) {
                withLabel++;
            }
            if (block.proof().isPresent()) {
                withProof++;
                proofLength += block.proof().get().length();
            }
            if (block.references().isPresent()) {
                withReferences++;
                totalReferences += block.references().get().size();
            }
            contentLength += block.content().length();
        }

        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> ordered = new LinkedHashMap<>();
        entries.forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));

        double averageContent = (double) contentLength / blocks.size();
        double averageProof = withProof == 0 ? 0.0 : (double) proofLength / withProof;
        return new ExtractionStatistics(blocks.size(), ordered, withTitle, withLabel, withProof, withReferences,
                totalReferences, averageContent, averageProof);
    }

    public double ratio(int count) {
        return totalBlocks == 0 ? 0.0 : (double) count / totalBlocks;
    }
}
