package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Difficulty of a generated question
 */
public enum Difficulty {

    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup used for model output: case-insensitive, null when unknown.
     */
    public static Difficulty fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Difficulty difficulty : values()) {
            if (difficulty.value.equals(normalized)) {
                return difficulty;
            }
        }
        return null;
    }
}
