package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One answer option of a question. The label is kept as produced by the model;
 * label rules are enforced by validation, not here.
 */
@JsonPropertyOrder({"label", "text", "is_correct"})
public record McqOption(
        @JsonProperty("label") String label,
        @JsonProperty("text") String text,
        @JsonProperty("is_correct") boolean correct
) {
}
