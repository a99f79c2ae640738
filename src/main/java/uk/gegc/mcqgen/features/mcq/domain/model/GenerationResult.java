package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one pipeline run: every generated question, its critique and its
 * validation, plus the valid/invalid partition derived once at construction.
 */
@Getter
@ToString
@JsonPropertyOrder({"query", "total_mcqs", "valid_count", "invalid_count",
        "mcqs", "critiques", "validations", "valid_mcqs"})
public final class GenerationResult {

    @JsonProperty("query")
    private final String query;

    @JsonIgnore
    private final RunOutcome outcome;

    @JsonProperty("mcqs")
    private final List<Mcq> mcqs;

    @JsonProperty("critiques")
    private final List<CritiqueResult> critiques;

    @JsonProperty("validations")
    private final List<ValidationResult> validations;

    @JsonProperty("valid_mcqs")
    private final List<Mcq> validMcqs;

    @JsonIgnore
    private final List<Mcq> invalidMcqs;

    public GenerationResult(String query,
                            RunOutcome outcome,
                            List<Mcq> mcqs,
                            List<CritiqueResult> critiques,
                            List<ValidationResult> validations) {
        this.query = query;
        this.outcome = outcome;
        this.mcqs = mcqs == null ? List.of() : List.copyOf(mcqs);
        this.critiques = critiques == null ? List.of() : List.copyOf(critiques);
        this.validations = validations == null ? List.of() : List.copyOf(validations);

        List<Mcq> valid = new ArrayList<>();
        List<Mcq> invalid = new ArrayList<>();
        for (int i = 0; i < this.mcqs.size(); i++) {
            Mcq mcq = this.mcqs.get(i);
            ValidationResult validation = i < this.validations.size() ? this.validations.get(i) : null;
            if (validation != null && belongsTo(validation, mcq) && validation.isValid()) {
                valid.add(mcq);
            } else {
                invalid.add(mcq);
            }
        }
        this.validMcqs = Collections.unmodifiableList(valid);
        this.invalidMcqs = Collections.unmodifiableList(invalid);
    }

    public static GenerationResult empty(String query, RunOutcome outcome) {
        return new GenerationResult(query, outcome, List.of(), List.of(), List.of());
    }

    @JsonProperty("total_mcqs")
    public int getTotalCount() {
        return mcqs.size();
    }

    @JsonProperty("valid_count")
    public int getValidCount() {
        return validMcqs.size();
    }

    @JsonProperty("invalid_count")
    public int getInvalidCount() {
        return invalidMcqs.size();
    }

    /**
     * Mean overall critique score, 0 when nothing was critiqued.
     */
    @JsonIgnore
    public double getAverageQualityScore() {
        return critiques.stream()
                .mapToDouble(CritiqueResult::getOverallScore)
                .average()
                .orElse(0.0);
    }

    // A record that names another question's id is not evidence for this one
    private static boolean belongsTo(ValidationResult validation, Mcq mcq) {
        return validation.mcqId() == null || validation.mcqId().equals(mcq.id());
    }
}
