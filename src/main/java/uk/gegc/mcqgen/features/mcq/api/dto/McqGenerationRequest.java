package uk.gegc.mcqgen.features.mcq.api.dto;

import uk.gegc.mcqgen.features.mcq.domain.model.Difficulty;

/**
 * Parameters of a single pipeline run.
 *
 * @param query      topic to generate questions about
 * @param count      questions to ask the model for, null for the configured default
 * @param difficulty requested difficulty, null to let the model estimate it
 * @param topK       fragments to retrieve, null for the configured default
 */
public record McqGenerationRequest(
        String query,
        Integer count,
        Difficulty difficulty,
        Integer topK
) {
    public McqGenerationRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (count != null && count < 1) {
            throw new IllegalArgumentException("Question count must be at least 1");
        }
        if (topK != null && topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
    }

    public static McqGenerationRequest of(String query) {
        return new McqGenerationRequest(query, null, null, null);
    }
}
