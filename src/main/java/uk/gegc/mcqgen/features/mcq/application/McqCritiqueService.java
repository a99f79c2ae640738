package uk.gegc.mcqgen.features.mcq.application;

import uk.gegc.mcqgen.features.mcq.domain.model.CritiqueResult;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.List;

/**
 * Scores generated questions against the fragment they cite
 */
public interface McqCritiqueService {

    /**
     * Critique every question, one model call each.
     *
     * @param mcqs      questions to critique
     * @param fragments the fragments the questions were generated from
     * @return one critique per question, in the same order; a failed call yields a neutral critique
     */
    List<CritiqueResult> critique(List<Mcq> mcqs, List<ContextFragment> fragments);
}
