package ai.mathdoc.extractor.export;

import static org.assertj.core.api.Assertions.assertThat;

import ai.mathdoc.extractor.parse.StatementBlock;
import ai.mathdoc.extractor.parse.StatementKind;
import ai.mathdoc.extractor.parse.StatementType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BlockJsonSerializerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private final List<StatementBlock> blocks = List.of(
            new StatementBlock(StatementKind.of(StatementType.THEOREM), Optional.of("thm:pit"), Optional.of("Pitágoras"),
                    "$a^2 + b^2 = c^2$", Optional.of("Por áreas."), Optional.of(List.of("def:triangulo"))),
            new StatementBlock(StatementKind.unclassified("axioma"), Optional.empty(), Optional.empty(),
                    "Existe un conjunto vacío.", Optional.empty(), Optional.empty()));

    @Test
    void writesAllFieldsInFixedOrder() throws Exception {
        JsonNode array = mapper.readTree(new BlockJsonSerializer(false).toJson(blocks));

        assertThat(array.isArray()).isTrue();
        assertThat(array).hasSize(2);
        List<String> fieldNames = new ArrayList<>();
        array.get(0).fieldNames().forEachRemaining(fieldNames::add);
        assertThat(fieldNames).containsExactly("type", "label", "title", "content_latex", "proof_latex", "references");

        JsonNode theorem = array.get(0);
        assertThat(theorem.get("type").asText()).isEqualTo("theorem");
        assertThat(theorem.get("label").asText()).isEqualTo("thm:pit");
        assertThat(theorem.get("title").asText()).isEqualTo("Pitágoras");
        assertThat(theorem.get("content_latex").asText()).isEqualTo("$a^2 + b^2 = c^2$");
        assertThat(theorem.get("proof_latex").asText()).isEqualTo("Por áreas.");
        assertThat(theorem.get("references").get(0).asText()).isEqualTo("def:triangulo");
    }

    @Test
    void writesAbsentValuesAsNull() throws Exception {
        JsonNode axiom = mapper.readTree(new BlockJsonSerializer(false).toJson(blocks)).get(1);

        assertThat(axiom.get("type").asText()).isEqualTo("axioma");
        assertThat(axiom.get("label").isNull()).isTrue();
        assertThat(axiom.get("title").isNull()).isTrue();
        assertThat(axiom.get("proof_latex").isNull()).isTrue();
        assertThat(axiom.get("references").isNull()).isTrue();
    }

    @Test
    void indentsOnlyWhenPretty() {
        assertThat(new BlockJsonSerializer(false).toJson(blocks)).doesNotContain("\n");
        assertThat(new BlockJsonSerializer(true).toJson(blocks)).contains("\n").contains("\"content_latex\" : ");
    }

    @Test
    void serializesEmptyResultAsEmptyArray() {
        assertThat(new BlockJsonSerializer(false).toJson(List.of())).isEqualTo("[]");
    }

    @Test
    void writesUtf8FileAndCreatesDirectories() throws Exception {
        Path target = tempDir.resolve("out/nested/blocks.json");

        new BlockJsonSerializer(true).write(blocks, target);

        String written = Files.readString(target, StandardCharsets.UTF_8);
        assertThat(written).contains("Pitágoras");
        assertThat(mapper.readTree(written)).hasSize(2);
    }
}
