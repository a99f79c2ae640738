package uk.gegc.mcqgen.features.mcq.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.mcqgen.McqTestData;
import uk.gegc.mcqgen.features.mcq.config.McqGenerationProperties;
import uk.gegc.mcqgen.features.mcq.domain.model.CritiqueResult;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.mcq.domain.model.McqOption;
import uk.gegc.mcqgen.features.mcq.domain.model.ValidationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.ValidationStatus;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("McqValidationServiceImpl Tests")
class McqValidationServiceImplTest {

    private McqGenerationProperties properties;
    private McqValidationServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new McqGenerationProperties();
        service = new McqValidationServiceImpl(properties);
    }

    private ValidationResult validateOne(Mcq mcq, CritiqueResult critique) {
        List<CritiqueResult> critiques = critique == null ? List.of() : List.of(critique);
        return service.validate(List.of(mcq), critiques, List.of(McqTestData.fragment("f1"))).get(0);
    }

    @Nested
    @DisplayName("Format Tests")
    class FormatTests {

        @Test
        @DisplayName("checkFormat: a well-formed question passes")
        void wellFormed_passes() {
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(McqTestData.validMcq(), errors)).isTrue();
            assertThat(errors).isEmpty();
        }

        @Test
        @DisplayName("checkFormat: three options fail the option count and label checks")
        void threeOptions_fails() {
            Mcq mcq = McqTestData.validMcqBuilder()
                    .options(McqTestData.options("A").subList(0, 3))
                    .build();
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(mcq, errors)).isFalse();
            assertThat(errors).contains("Must have exactly 4 options, found 3", "Invalid option labels: [A, B, C]");
        }

        @Test
        @DisplayName("checkFormat: two options flagged correct fail")
        void twoCorrect_fails() {
            Mcq mcq = McqTestData.validMcqBuilder()
                    .options(List.of(
                            new McqOption("A", "one", true),
                            new McqOption("B", "two", true),
                            new McqOption("C", "three", false),
                            new McqOption("D", "four", false)))
                    .build();
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(mcq, errors)).isFalse();
            assertThat(errors).containsExactly("Must have exactly 1 correct answer, found 2");
        }

        @Test
        @DisplayName("checkFormat: declared answer must be the option flagged correct")
        void correctAnswerMismatch_fails() {
            Mcq mcq = McqTestData.validMcqBuilder().correctAnswer("B").build();
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(mcq, errors)).isFalse();
            assertThat(errors).containsExactly("Correct answer B does not match the option flagged correct");
        }

        @Test
        @DisplayName("checkFormat: short question and short explanation fail")
        void shortTexts_fail() {
            Mcq mcq = McqTestData.validMcqBuilder().question("  Why?  ").explanation("").build();
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(mcq, errors)).isFalse();
            assertThat(errors).containsExactly("Question is too short or empty", "Explanation is too short or empty");
        }

        @Test
        @DisplayName("checkFormat: a 9-character question fails and a 10-character one passes")
        void questionLengthBoundary() {
            List<String> nineErrors = new ArrayList<>();
            List<String> tenErrors = new ArrayList<>();

            boolean nine = service.checkFormat(McqTestData.validMcqBuilder().question("Which one").build(), nineErrors);
            boolean ten = service.checkFormat(McqTestData.validMcqBuilder().question("Which one?").build(), tenErrors);

            assertThat(nine).isFalse();
            assertThat(nineErrors).containsExactly("Question is too short or empty");
            assertThat(ten).isTrue();
            assertThat(tenErrors).isEmpty();
        }

        @Test
        @DisplayName("checkFormat: no option flagged correct fails")
        void zeroCorrect_fails() {
            Mcq mcq = McqTestData.validMcqBuilder()
                    .options(McqTestData.options("none"))
                    .build();
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(mcq, errors)).isFalse();
            assertThat(errors).containsExactly("Must have exactly 1 correct answer, found 0");
        }

        @Test
        @DisplayName("checkFormat: unexpected labels fail")
        void wrongLabels_fail() {
            Mcq mcq = McqTestData.validMcqBuilder()
                    .options(List.of(
                            new McqOption("A", "one", true),
                            new McqOption("B", "two", false),
                            new McqOption("C", "three", false),
                            new McqOption("E", "four", false)))
                    .build();
            List<String> errors = new ArrayList<>();

            assertThat(service.checkFormat(mcq, errors)).isFalse();
            assertThat(errors).containsExactly("Invalid option labels: [A, B, C, E]");
        }
    }

    @Test
    @DisplayName("checkMetadata: missing provenance and difficulty are reported")
    void checkMetadata_missingFields() {
        Mcq mcq = McqTestData.validMcqBuilder().fragmentId("").sourceFilename(null).difficulty(null).build();
        List<String> errors = new ArrayList<>();

        assertThat(service.checkMetadata(mcq, errors)).isFalse();
        assertThat(errors).containsExactly("Missing chunk_id", "Missing source_filename", "Missing difficulty level");
    }

    @Nested
    @DisplayName("Grounding Tests")
    class GroundingTests {

        @Test
        @DisplayName("validate: grounding 5.5 is ungrounded but not a hallucination")
        void grounding55_ungroundedOnly() {
            Mcq mcq = McqTestData.validMcq();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, mcq, 8, 8, 5.5));

            assertThat(result.contextGrounded()).isFalse();
            assertThat(result.hallucination()).isFalse();
            assertThat(result.validationErrors()).containsExactly("Low grounding score: 5.5/10");
            assertThat(result.isValid()).isFalse();
        }

        @Test
        @DisplayName("validate: grounding 4.0 is ungrounded and a hallucination")
        void grounding40_hallucination() {
            Mcq mcq = McqTestData.validMcq();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, mcq, 8, 8, 4.0));

            assertThat(result.contextGrounded()).isFalse();
            assertThat(result.hallucination()).isTrue();
            assertThat(result.validationErrors())
                    .containsExactly("Low grounding score: 4.0/10", "Potential hallucination detected");
        }

        @Test
        @DisplayName("validate: thresholds are configurable independently")
        void thresholds_configurable() {
            properties.getValidation().setGroundingThreshold(3.0);
            properties.getValidation().setHallucinationThreshold(2.0);
            Mcq mcq = McqTestData.validMcq();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, mcq, 8, 8, 4.0));

            assertThat(result.isValid()).isTrue();
        }

        @Test
        @DisplayName("validate: without a critique only the rule-based checks apply")
        void noCritique_ruleBasedOnly() {
            ValidationResult result = validateOne(McqTestData.validMcq(), null);

            assertThat(result.status()).isEqualTo(ValidationStatus.VALID);
            assertThat(result.contextGrounded()).isTrue();
            assertThat(result.hallucination()).isFalse();
        }
    }

    @Nested
    @DisplayName("Status Tests")
    class StatusTests {

        @Test
        @DisplayName("validate: no errors is VALID")
        void noErrors_valid() {
            Mcq mcq = McqTestData.validMcq();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, mcq, 9, 9, 9));

            assertThat(result.status()).isEqualTo(ValidationStatus.VALID);
            assertThat(result.isValid()).isTrue();
            assertThat(result.mcqId()).isEqualTo(mcq.id());
        }

        @Test
        @DisplayName("validate: errors with a high overall score is NEEDS_REVISION")
        void errorsHighScore_needsRevision() {
            Mcq mcq = McqTestData.validMcqBuilder().explanation("Short").build();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, mcq, 9, 9, 9));

            assertThat(result.status()).isEqualTo(ValidationStatus.NEEDS_REVISION);
            assertThat(result.properlyFormatted()).isFalse();
            assertThat(result.isValid()).isFalse();
        }

        @Test
        @DisplayName("validate: errors with a low overall score is INVALID")
        void errorsLowScore_invalid() {
            Mcq mcq = McqTestData.validMcq();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, mcq, 5, 5, 2));

            assertThat(result.status()).isEqualTo(ValidationStatus.INVALID);
        }

        @Test
        @DisplayName("validate: a critique belonging to another question is ignored")
        void foreignCritique_ignored() {
            Mcq mcq = McqTestData.validMcq();
            Mcq other = McqTestData.validMcq();

            ValidationResult result = validateOne(mcq, McqTestData.critique(0, other, 1, 1, 1));

            assertThat(result.status()).isEqualTo(ValidationStatus.VALID);
            assertThat(result.contextGrounded()).isTrue();
        }

        @Test
        @DisplayName("validate: one result per question, in order")
        void oneResultPerQuestion() {
            Mcq first = McqTestData.validMcq();
            Mcq second = McqTestData.validMcqBuilder().options(List.of()).build();

            List<ValidationResult> results = service.validate(List.of(first, second),
                    List.of(McqTestData.critique(0, first, 9, 9, 9), McqTestData.critique(1, second, 3, 3, 3)),
                    List.of());

            assertThat(results).extracting(ValidationResult::mcqIndex).containsExactly(0, 1);
            assertThat(results).extracting(ValidationResult::isValid).containsExactly(true, false);
        }
    }
}
