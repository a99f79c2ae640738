package uk.gegc.mcqgen.features.mcq.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.mcq.application.McqResultExporter;
import uk.gegc.mcqgen.features.mcq.domain.model.BatchGenerationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.GenerationResult;
import uk.gegc.mcqgen.shared.exception.McqExportException;

@Component
@RequiredArgsConstructor
public class JacksonMcqResultExporter implements McqResultExporter {

    private final ObjectMapper objectMapper;

    @Override
    public String toJson(GenerationResult result) {
        return write(result, "generation result for query '" + result.getQuery() + "'");
    }

    @Override
    public String toJson(BatchGenerationResult result) {
        return write(result, "batch result of " + result.getQueriesProcessed() + " queries");
    }

    private String write(Object value, String description) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new McqExportException("Failed to serialize " + description, e);
        }
    }
}
