package uk.gegc.mcqgen.features.ai.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.mcqgen.shared.exception.AIResponseParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StructuredResponseParser Tests")
class StructuredResponseParserTest {

    private StructuredResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new StructuredResponseParser(new ObjectMapper());
    }

    @Nested
    @DisplayName("Code Fence Tests")
    class CodeFenceTests {

        @Test
        @DisplayName("stripCodeFence: json fence body is extracted")
        void jsonFence_extracted() {
            String response = "Here you go:\n```json\n[{\"a\": 1}]\n```\nThanks";

            assertThat(parser.stripCodeFence(response)).isEqualTo("[{\"a\": 1}]");
        }

        @Test
        @DisplayName("stripCodeFence: plain fence body is extracted")
        void plainFence_extracted() {
            assertThat(parser.stripCodeFence("```\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        }

        @Test
        @DisplayName("stripCodeFence: unfenced text is only trimmed")
        void noFence_trimmed() {
            assertThat(parser.stripCodeFence("  {\"a\": 1}\n")).isEqualTo("{\"a\": 1}");
        }
    }

    @Test
    @DisplayName("parseArray: fenced array is parsed")
    void parseArray_fenced() {
        JsonNode node = parser.parseArray("```json\n[{\"question\": \"Q?\"}, {\"question\": \"R?\"}]\n```");

        assertThat(node.isArray()).isTrue();
        assertThat(node.size()).isEqualTo(2);
        assertThat(node.get(1).get("question").asText()).isEqualTo("R?");
    }

    @Test
    @DisplayName("parseArray: an object where an array is expected is rejected")
    void parseArray_object_rejected() {
        assertThatThrownBy(() -> parser.parseArray("{\"question\": \"Q?\"}"))
                .isInstanceOf(AIResponseParseException.class)
                .hasMessageContaining("Expected a JSON array");
    }

    @Test
    @DisplayName("parseObject: an array where an object is expected is rejected")
    void parseObject_array_rejected() {
        assertThatThrownBy(() -> parser.parseObject("[1, 2]"))
                .isInstanceOf(AIResponseParseException.class)
                .hasMessageContaining("Expected a JSON object");
    }

    @Test
    @DisplayName("invalid JSON is reported as a parse error")
    void invalidJson_rejected() {
        assertThatThrownBy(() -> parser.parseObject("I cannot help with that."))
                .isInstanceOf(AIResponseParseException.class)
                .hasMessageContaining("Invalid JSON in AI response");
    }

    @Test
    @DisplayName("blank response is reported as empty")
    void blankResponse_rejected() {
        assertThatThrownBy(() -> parser.parseArray("   "))
                .isInstanceOf(AIResponseParseException.class)
                .hasMessage("AI response is empty");
    }
}
