package uk.gegc.mcqgen.features.mcq.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.mcq.application.McqValidationService;
import uk.gegc.mcqgen.features.mcq.config.McqGenerationProperties;
import uk.gegc.mcqgen.features.mcq.domain.model.CritiqueResult;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.mcq.domain.model.McqOption;
import uk.gegc.mcqgen.features.mcq.domain.model.OptionLabel;
import uk.gegc.mcqgen.features.mcq.domain.model.ValidationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.ValidationStatus;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rule-based validation of generated questions. Makes no external calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class McqValidationServiceImpl implements McqValidationService {

    static final int REQUIRED_OPTION_COUNT = 4;

    private final McqGenerationProperties properties;

    @Override
    public List<ValidationResult> validate(List<Mcq> mcqs,
                                           List<CritiqueResult> critiques,
                                           List<ContextFragment> fragments) {
        List<ValidationResult> validations = new ArrayList<>(mcqs.size());
        for (int i = 0; i < mcqs.size(); i++) {
            validations.add(validateOne(i, mcqs.get(i), critiqueFor(i, mcqs.get(i), critiques)));
        }

        long valid = validations.stream().filter(ValidationResult::isValid).count();
        log.info("Validation complete: {}/{} MCQs passed", valid, mcqs.size());
        return validations;
    }

    private ValidationResult validateOne(int index, Mcq mcq, CritiqueResult critique) {
        McqGenerationProperties.Validation rules = properties.getValidation();
        List<String> errors = new ArrayList<>();

        boolean properlyFormatted = checkFormat(mcq, errors);
        boolean requiredMetadata = checkMetadata(mcq, errors);

        boolean contextGrounded = true;
        if (critique != null && critique.getGroundingScore() < rules.getGroundingThreshold()) {
            contextGrounded = false;
            errors.add("Low grounding score: " + critique.getGroundingScore() + "/10");
        }

        boolean hallucination = false;
        if (critique != null && critique.getGroundingScore() < rules.getHallucinationThreshold()) {
            hallucination = true;
            errors.add("Potential hallucination detected");
        }

        ValidationStatus status;
        if (errors.isEmpty()) {
            status = ValidationStatus.VALID;
        } else if (critique != null && critique.getOverallScore() >= rules.getRevisionScoreThreshold()) {
            status = ValidationStatus.NEEDS_REVISION;
        } else {
            status = ValidationStatus.INVALID;
        }

        return new ValidationResult(index, mcq.id(), status, contextGrounded, properlyFormatted,
                requiredMetadata, hallucination, errors);
    }

    boolean checkFormat(Mcq mcq, List<String> errors) {
        McqGenerationProperties.Validation rules = properties.getValidation();
        boolean valid = true;

        if (trimmedLength(mcq.question()) < rules.getMinQuestionLength()) {
            errors.add("Question is too short or empty");
            valid = false;
        }

        if (mcq.options().size() != REQUIRED_OPTION_COUNT) {
            errors.add("Must have exactly " + REQUIRED_OPTION_COUNT + " options, found " + mcq.options().size());
            valid = false;
        }

        List<McqOption> correctOptions = mcq.options().stream().filter(McqOption::correct).toList();
        if (correctOptions.size() != 1) {
            errors.add("Must have exactly 1 correct answer, found " + correctOptions.size());
            valid = false;
        } else if (!correctOptions.get(0).label().equals(mcq.correctAnswer())) {
            errors.add("Correct answer " + mcq.correctAnswer() + " does not match the option flagged correct");
            valid = false;
        }

        if (trimmedLength(mcq.explanation()) < rules.getMinExplanationLength()) {
            errors.add("Explanation is too short or empty");
            valid = false;
        }

        Set<String> actualLabels = mcq.options().stream()
                .map(McqOption::label)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!actualLabels.equals(OptionLabel.expectedLabels())) {
            errors.add("Invalid option labels: " + actualLabels);
            valid = false;
        }

        return valid;
    }

    boolean checkMetadata(Mcq mcq, List<String> errors) {
        boolean valid = true;

        if (mcq.fragmentId() == null || mcq.fragmentId().isEmpty()) {
            errors.add("Missing chunk_id");
            valid = false;
        }

        if (mcq.sourceFilename() == null || mcq.sourceFilename().isEmpty()) {
            errors.add("Missing source_filename");
            valid = false;
        }

        if (mcq.difficulty() == null) {
            errors.add("Missing difficulty level");
            valid = false;
        }

        return valid;
    }

    /**
     * Positional match, rejected when the critique names a different question.
     */
    private CritiqueResult critiqueFor(int index, Mcq mcq, List<CritiqueResult> critiques) {
        if (critiques == null || index >= critiques.size()) {
            return null;
        }
        CritiqueResult critique = critiques.get(index);
        if (critique != null && critique.getMcqId() != null && !critique.getMcqId().equals(mcq.id())) {
            log.warn("Critique at position {} belongs to another MCQ, ignoring it", index);
            return null;
        }
        return critique;
    }

    private static int trimmedLength(String value) {
        return value == null ? 0 : value.trim().length();
    }
}
