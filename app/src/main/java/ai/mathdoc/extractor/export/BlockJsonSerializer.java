package ai.mathdoc.extractor.export;

import ai.mathdoc.extractor.parse.StatementBlock;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes extracted blocks as a JSON array for downstream formalization tools.
 *
 * <p>Every object carries all six fields; absent label, title, proof or references are written as {@code null}.
 */
public class BlockJsonSerializer {

    private final ObjectWriter writer;

    public BlockJsonSerializer(boolean pretty) {
        ObjectMapper mapper = new ObjectMapper();
        this.writer = pretty
                ? mapper.writer().with(SerializationFeature.INDENT_OUTPUT)
                : mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(List<StatementBlock> blocks) {
        try {
            return writer.writeValueAsString(toDocuments(blocks));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize statement blocks", ex);
        }
    }

    public void write(List<StatementBlock> blocks, Path target) {
        if (target == null) {
            throw new IllegalArgumentException("target must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(blocks), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write JSON export: " + target, ex);
        }
    }

    private static List<BlockDocument> toDocuments(List<StatementBlock> blocks) {
        if (blocks == null) {
            return List.of();
        }
        return blocks.stream()
                .map(block -> new BlockDocument(
                        block.kind().name(),
                        block.label().orElse(null),
                        block.title().orElse(null),
                        block.content(),
                        block.proof().orElse(null),
                        block.references().orElse(null)))
                .toList();
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonPropertyOrder({"type", "label", "title", "content_latex", "proof_latex", "references"})
    record BlockDocument(
            @JsonProperty("type") String type,
            @JsonProperty("label") String label,
            @JsonProperty("title") String title,
            @JsonProperty("content_latex") String contentLatex,
            @JsonProperty("proof_latex") String proofLatex,
            @JsonProperty("references") List<String> references) {
    }
}
