package uk.gegc.mcqgen.features.ai.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.ai.application.StructuredCompletionService;
import uk.gegc.mcqgen.features.ai.application.TextGenerationClient;
import uk.gegc.mcqgen.features.ai.infra.parser.StructuredCompletion;
import uk.gegc.mcqgen.features.ai.infra.parser.StructuredResponseParser;
import uk.gegc.mcqgen.shared.exception.AIResponseParseException;
import uk.gegc.mcqgen.shared.exception.AiServiceException;

import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonStructuredCompletionService implements StructuredCompletionService {

    private static final Logger AI_RESPONSE_LOG = LoggerFactory.getLogger("ai.response.logger");

    private final TextGenerationClient textGenerationClient;
    private final StructuredResponseParser responseParser;

    @Override
    public StructuredCompletion<JsonNode> completeArray(String prompt, Double temperature) {
        return complete(prompt, temperature, responseParser::parseArray);
    }

    @Override
    public StructuredCompletion<JsonNode> completeObject(String prompt, Double temperature) {
        return complete(prompt, temperature, responseParser::parseObject);
    }

    private StructuredCompletion<JsonNode> complete(String prompt,
                                                    Double temperature,
                                                    Function<String, JsonNode> parser) {
        String rawResponse;
        try {
            rawResponse = textGenerationClient.complete(prompt, temperature);
        } catch (AiServiceException e) {
            log.warn("Text generation service failed: {}", e.getMessage());
            return StructuredCompletion.serviceError(e.getMessage());
        }

        AI_RESPONSE_LOG.debug("{}", rawResponse);

        try {
            return StructuredCompletion.ok(parser.apply(rawResponse));
        } catch (AIResponseParseException e) {
            log.warn("Malformed AI response: {}", e.getMessage());
            return StructuredCompletion.parseError(e.getMessage());
        }
    }
}
