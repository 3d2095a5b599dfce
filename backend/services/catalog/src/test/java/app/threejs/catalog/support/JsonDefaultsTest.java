package app.threejs.catalog.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonDefaultsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void missingOrMistypedFieldsFallBackToDefaults() throws Exception {
        JsonNode node = objectMapper.readTree("""
                {"name": null, "nested": {"a": 1}, "flag": "true", "size": "12.9", "bad": "x"}
                """);

        assertThat(JsonDefaults.text(node, "name")).isEmpty();
        assertThat(JsonDefaults.text(node, "nested")).isEmpty();
        assertThat(JsonDefaults.text(node, "absent", "fallback")).isEqualTo("fallback");
        assertThat(JsonDefaults.bool(node, "flag")).isFalse();
        assertThat(JsonDefaults.number(node, "size", 0)).isEqualTo(12L);
        assertThat(JsonDefaults.number(node, "bad", -1)).isEqualTo(-1L);
        assertThat(JsonDefaults.object(node, "nested")).isNotNull();
        assertThat(JsonDefaults.object(node, "name")).isNull();
        assertThat(JsonDefaults.text(null, "name")).isEmpty();
    }

    @Test
    void firstNonBlankSkipsBlankValues() {
        assertThat(JsonDefaults.firstNonBlank(null, " ", "id")).isEqualTo("id");
        assertThat(JsonDefaults.firstNonBlank()).isEmpty();
    }
}
