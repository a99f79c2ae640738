package uk.gegc.mcqgen.features.mcq.application;

import uk.gegc.mcqgen.features.mcq.domain.model.BatchGenerationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.GenerationResult;

/**
 * Renders results in their published JSON shape
 */
public interface McqResultExporter {

    /**
     * @throws uk.gegc.mcqgen.shared.exception.McqExportException if serialization fails
     */
    String toJson(GenerationResult result);

    /**
     * @throws uk.gegc.mcqgen.shared.exception.McqExportException if serialization fails
     */
    String toJson(BatchGenerationResult result);
}
