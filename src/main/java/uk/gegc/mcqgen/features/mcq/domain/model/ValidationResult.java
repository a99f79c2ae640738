package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.UUID;

/**
 * Validation verdict for one question.
 */
@JsonPropertyOrder({"mcq_index", "status", "is_valid", "is_context_grounded", "is_properly_formatted",
        "has_required_metadata", "has_hallucination", "validation_errors"})
public record ValidationResult(
        @JsonProperty("mcq_index") int mcqIndex,
        @JsonIgnore UUID mcqId,
        @JsonProperty("status") ValidationStatus status,
        @JsonProperty("is_context_grounded") boolean contextGrounded,
        @JsonProperty("is_properly_formatted") boolean properlyFormatted,
        @JsonProperty("has_required_metadata") boolean requiredMetadata,
        @JsonProperty("has_hallucination") boolean hallucination,
        @JsonProperty("validation_errors") List<String> validationErrors
) {
    public ValidationResult {
        validationErrors = (validationErrors == null) ? List.of() : List.copyOf(validationErrors);
    }

    /**
     * Status alone is not enough: every flag is checked on its own as well.
     */
    @JsonProperty("is_valid")
    public boolean isValid() {
        return status == ValidationStatus.VALID
                && contextGrounded
                && properlyFormatted
                && requiredMetadata
                && !hallucination;
    }
}
