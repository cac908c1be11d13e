package org.javai.dbresilience.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StructuredResultWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StructuredResultWriter writer = new StructuredResultWriter();

    @Test
    void success_omitsNullFields() throws Exception {
        String json = writer.toJson(StructuredResult.success(Map.of("rowCount", 1, "rows", List.of(Map.of("id", 7)))));

        JsonNode node = MAPPER.readTree(json);
        assertThat(node.get("success").asBoolean()).isTrue();
        assertThat(node.at("/data/rows/0/id").asInt()).isEqualTo(7);
        assertThat(node.has("error")).isFalse();
        assertThat(node.has("isTransient")).isFalse();
        assertThat(json).contains("\n");
    }

    @Test
    void failure_usesStableFieldNames() throws Exception {
        String json = writer.toJson(StructuredResult.failure("duplicate key", "23505", false,
                OutcomeReporter.PERMANENT_SUGGESTION, 1));

        JsonNode node = MAPPER.readTree(json);
        assertThat(node.get("success").asBoolean()).isFalse();
        assertThat(node.get("error").asText()).isEqualTo("duplicate key");
        assertThat(node.get("diagnosticCode").asText()).isEqualTo("23505");
        assertThat(node.get("isTransient").asBoolean()).isFalse();
        assertThat(node.get("attempts").asInt()).isEqualTo(1);
        assertThat(node.has("data")).isFalse();
    }

    @Test
    void unserializableData_fallsBackToMinimalDocument() throws Exception {
        Object selfReferencing = new SelfReferencing();

        String json = writer.toJson(StructuredResult.success(selfReferencing));

        JsonNode node = MAPPER.readTree(json);
        assertThat(node.get("success").asBoolean()).isFalse();
        assertThat(node.get("error").asText()).isNotBlank();
    }

    @Test
    void minimal_escapesMessage() throws Exception {
        JsonNode node = MAPPER.readTree(StructuredResultWriter.minimal("quote \" and\nnewline"));

        assertThat(node.get("error").asText()).isEqualTo("quote \" and\nnewline");
    }

    static final class SelfReferencing {
        public SelfReferencing getSelf() {
            return this;
        }
    }
}
