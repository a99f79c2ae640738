package uk.gegc.mcqgen.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.shared.exception.AIResponseParseException;

/**
 * Parses model answers that are expected to be JSON, tolerating a surrounding
 * markdown code fence.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StructuredResponseParser {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    /**
     * Parse a response that must be a JSON array
     *
     * @throws AIResponseParseException if the text is not JSON or not an array
     */
    public JsonNode parseArray(String aiResponse) {
        JsonNode node = readTree(aiResponse);
        if (!node.isArray()) {
            throw new AIResponseParseException("Expected a JSON array but got " + node.getNodeType());
        }
        return node;
    }

    /**
     * Parse a response that must be a single JSON object
     *
     * @throws AIResponseParseException if the text is not JSON or not an object
     */
    public JsonNode parseObject(String aiResponse) {
        JsonNode node = readTree(aiResponse);
        if (!node.isObject()) {
            throw new AIResponseParseException("Expected a JSON object but got " + node.getNodeType());
        }
        return node;
    }

    /**
     * Return the body of the first fenced block ({@code ```json} preferred), or the trimmed text when unfenced
     */
    public String stripCodeFence(String aiResponse) {
        String cleaned = aiResponse.trim();

        int jsonFence = cleaned.indexOf(JSON_FENCE);
        if (jsonFence >= 0) {
            return bodyUntilClosingFence(cleaned, jsonFence + JSON_FENCE.length());
        }

        int fence = cleaned.indexOf(FENCE);
        if (fence >= 0) {
            return bodyUntilClosingFence(cleaned, fence + FENCE.length());
        }

        return cleaned;
    }

    private JsonNode readTree(String aiResponse) {
        if (aiResponse == null || aiResponse.isBlank()) {
            throw new AIResponseParseException("AI response is empty");
        }

        String cleaned = stripCodeFence(aiResponse);
        try {
            JsonNode node = objectMapper.readTree(cleaned);
            if (node == null || node.isMissingNode()) {
                throw new AIResponseParseException("AI response contains no JSON content");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.debug("Unparsable AI response: {}", cleaned);
            throw new AIResponseParseException("Invalid JSON in AI response: " + e.getOriginalMessage(), e);
        }
    }

    private static String bodyUntilClosingFence(String text, int bodyStart) {
        int closing = text.indexOf(FENCE, bodyStart);
        String body = closing >= 0 ? text.substring(bodyStart, closing) : text.substring(bodyStart);
        return body.trim();
    }
}
