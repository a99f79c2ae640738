package uk.gegc.mcqgen.features.mcq.application;

import uk.gegc.mcqgen.features.mcq.api.dto.McqBatchRequest;
import uk.gegc.mcqgen.features.mcq.api.dto.McqGenerationRequest;
import uk.gegc.mcqgen.features.mcq.domain.model.BatchGenerationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.GenerationResult;

/**
 * Runs retrieval, generation, critique and validation for a query and
 * aggregates the outcome.
 */
public interface McqPipelineService {

    /**
     * Run the pipeline for one query. Empty retrieval or empty generation end the
     * run early with an empty result; no stage failure escapes as an exception.
     */
    GenerationResult run(McqGenerationRequest request);

    /**
     * Run the pipeline once per query. A failing query yields an empty result and
     * does not stop the batch.
     */
    BatchGenerationResult runBatch(McqBatchRequest request);
}
