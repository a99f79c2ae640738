package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict assigned to a question by the validation stage
 */
public enum ValidationStatus {

    /**
     * No validation error was recorded
     */
    VALID("valid"),

    /**
     * Errors were recorded and the critique did not rate the question highly enough to salvage it
     */
    INVALID("invalid"),

    /**
     * Errors were recorded but the critique's overall score makes the question salvageable
     */
    NEEDS_REVISION("needs_revision");

    private final String value;

    ValidationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
