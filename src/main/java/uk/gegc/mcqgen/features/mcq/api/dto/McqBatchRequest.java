package uk.gegc.mcqgen.features.mcq.api.dto;

import uk.gegc.mcqgen.features.mcq.domain.model.Difficulty;

import java.util.List;

/**
 * Parameters shared by every query of a batch run.
 */
public record McqBatchRequest(
        List<String> queries,
        Integer countPerQuery,
        Difficulty difficulty,
        Integer topK
) {
    public McqBatchRequest {
        queries = (queries == null) ? List.of() : List.copyOf(queries);
        if (countPerQuery != null && countPerQuery < 1) {
            throw new IllegalArgumentException("Question count per query must be at least 1");
        }
        if (topK != null && topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
    }

    public McqGenerationRequest requestFor(String query) {
        return new McqGenerationRequest(query, countPerQuery, difficulty, topK);
    }
}
