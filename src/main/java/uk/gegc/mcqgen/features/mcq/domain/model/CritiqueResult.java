package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.UUID;

/**
 * Three-axis quality assessment of one question.
 * <p>
 * The overall score is always the mean of the three axis scores; it is computed
 * here and cannot be supplied by callers.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"mcq_index", "clarity_score", "correctness_score", "grounding_score",
        "overall_score", "difficulty_assessment", "issues", "suggestions"})
public final class CritiqueResult {

    static final String UNVERIFIABLE_ISSUE = "Could not find source context for verification";
    static final String UNVERIFIABLE_SUGGESTION = "Verify MCQ against original source";
    static final String INCOMPLETE_ISSUE = "Could not complete full critique";
    static final String INCOMPLETE_SUGGESTION = "Manual review recommended";

    @JsonProperty("mcq_index")
    private final int mcqIndex;

    @JsonIgnore
    private final UUID mcqId;

    @JsonProperty("clarity_score")
    private final double clarityScore;

    @JsonProperty("correctness_score")
    private final double correctnessScore;

    @JsonProperty("grounding_score")
    private final double groundingScore;

    @JsonProperty("difficulty_assessment")
    private final Difficulty difficultyAssessment;

    @JsonProperty("issues")
    private final List<String> issues;

    @JsonProperty("suggestions")
    private final List<String> suggestions;

    @JsonProperty("overall_score")
    private final double overallScore;

    public CritiqueResult(int mcqIndex,
                          UUID mcqId,
                          double clarityScore,
                          double correctnessScore,
                          double groundingScore,
                          Difficulty difficultyAssessment,
                          List<String> issues,
                          List<String> suggestions) {
        this.mcqIndex = mcqIndex;
        this.mcqId = mcqId;
        this.clarityScore = clarityScore;
        this.correctnessScore = correctnessScore;
        this.groundingScore = groundingScore;
        this.difficultyAssessment = difficultyAssessment;
        this.issues = issues == null ? List.of() : List.copyOf(issues);
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.overallScore = (clarityScore + correctnessScore + groundingScore) / 3.0;
    }

    /**
     * Critique used when there is no fragment to check the question against.
     */
    public static CritiqueResult unverifiable(int mcqIndex, Mcq mcq) {
        return new CritiqueResult(mcqIndex, mcq.id(), 5.0, 5.0, 0.0, mcq.difficulty(),
                List.of(UNVERIFIABLE_ISSUE), List.of(UNVERIFIABLE_SUGGESTION));
    }

    /**
     * Neutral critique substituted when the critique call or its parsing failed.
     */
    public static CritiqueResult neutral(int mcqIndex, Mcq mcq) {
        return new CritiqueResult(mcqIndex, mcq.id(), 7.0, 7.0, 7.0, mcq.difficulty(),
                List.of(INCOMPLETE_ISSUE), List.of(INCOMPLETE_SUGGESTION));
    }
}
