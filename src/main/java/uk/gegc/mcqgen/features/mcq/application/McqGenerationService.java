package uk.gegc.mcqgen.features.mcq.application;

import uk.gegc.mcqgen.features.mcq.domain.model.Difficulty;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.List;

/**
 * Turns retrieved fragments into candidate questions through the language model
 */
public interface McqGenerationService {

    /**
     * Generate questions from the given fragments with a single model call.
     * Never throws on model or parsing problems: the whole call degrades to an empty list.
     *
     * @param fragments  context to draw questions from; empty means no model call
     * @param count      number of questions to ask for
     * @param difficulty requested difficulty, or null to let the model estimate it
     * @return generated questions in model order, empty on any failure
     */
    List<Mcq> generate(List<ContextFragment> fragments, int count, Difficulty difficulty);
}
