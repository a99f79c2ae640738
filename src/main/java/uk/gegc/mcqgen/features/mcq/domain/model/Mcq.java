package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A generated multiple choice question together with the provenance of the
 * fragment it was drawn from. Immutable; a revision would be a new instance.
 *
 * @param id              identifier assigned at creation, carried by critiques and validations
 * @param question        question stem
 * @param options         options in the order the model produced them
 * @param correctAnswer   label the model declared as correct
 * @param explanation     why the correct answer is correct
 * @param difficulty      estimated difficulty, null only when the model omitted it
 * @param fragmentId      id of the source fragment
 * @param sourceFilename  file the source fragment came from
 * @param contextSnippet  leading excerpt of the source fragment
 * @param metadata        generation bookkeeping (generation order, requested difficulty)
 */
@Builder
@JsonPropertyOrder({"question", "options", "correct_answer", "explanation", "difficulty",
        "chunk_id", "source_filename", "context_snippet", "metadata"})
public record Mcq(
        @JsonIgnore UUID id,
        @JsonProperty("question") String question,
        @JsonProperty("options") List<McqOption> options,
        @JsonProperty("correct_answer") String correctAnswer,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("difficulty") Difficulty difficulty,
        @JsonProperty("chunk_id") String fragmentId,
        @JsonProperty("source_filename") String sourceFilename,
        @JsonProperty("context_snippet") String contextSnippet,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public Mcq {
        id = (id == null) ? UUID.randomUUID() : id;
        options = (options == null) ? List.of() : List.copyOf(options);
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
        contextSnippet = (contextSnippet == null) ? "" : contextSnippet;
    }

    public long countCorrectOptions() {
        return options.stream().filter(McqOption::correct).count();
    }
}
