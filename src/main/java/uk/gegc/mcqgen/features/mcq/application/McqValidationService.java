package uk.gegc.mcqgen.features.mcq.application;

import uk.gegc.mcqgen.features.mcq.domain.model.CritiqueResult;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.mcq.domain.model.ValidationResult;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.List;

/**
 * Deterministic structural, metadata and grounding checks
 */
public interface McqValidationService {

    /**
     * @param mcqs      questions to validate
     * @param critiques critiques matched to questions by position
     * @param fragments the fragments the questions were generated from
     * @return one verdict per question, in the same order
     */
    List<ValidationResult> validate(List<Mcq> mcqs, List<CritiqueResult> critiques, List<ContextFragment> fragments);
}
