package uk.gegc.mcqgen.features.mcq.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.mcq.api.dto.McqBatchRequest;
import uk.gegc.mcqgen.features.mcq.api.dto.McqGenerationRequest;
import uk.gegc.mcqgen.features.mcq.application.McqCritiqueService;
import uk.gegc.mcqgen.features.mcq.application.McqGenerationService;
import uk.gegc.mcqgen.features.mcq.application.McqPipelineService;
import uk.gegc.mcqgen.features.mcq.application.McqValidationService;
import uk.gegc.mcqgen.features.mcq.config.McqGenerationProperties;
import uk.gegc.mcqgen.features.mcq.domain.model.BatchGenerationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.CritiqueResult;
import uk.gegc.mcqgen.features.mcq.domain.model.GenerationResult;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.mcq.domain.model.RunOutcome;
import uk.gegc.mcqgen.features.mcq.domain.model.ValidationResult;
import uk.gegc.mcqgen.features.retrieval.application.ContextRetriever;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Service
@Slf4j
public class McqPipelineServiceImpl implements McqPipelineService {

    private final ContextRetriever contextRetriever;
    private final McqGenerationService generationService;
    private final McqCritiqueService critiqueService;
    private final McqValidationService validationService;
    private final McqGenerationProperties properties;
    private final Executor aiTaskExecutor;

    public McqPipelineServiceImpl(ContextRetriever contextRetriever,
                                  McqGenerationService generationService,
                                  McqCritiqueService critiqueService,
                                  McqValidationService validationService,
                                  McqGenerationProperties properties,
                                  @Qualifier("aiTaskExecutor") Executor aiTaskExecutor) {
        this.contextRetriever = contextRetriever;
        this.generationService = generationService;
        this.critiqueService = critiqueService;
        this.validationService = validationService;
        this.properties = properties;
        this.aiTaskExecutor = aiTaskExecutor;
    }

    @Override
    public GenerationResult run(McqGenerationRequest request) {
        String query = request.query();
        int count = request.count() != null ? request.count() : properties.getDefaultCount();
        int topK = request.topK() != null ? request.topK() : properties.getDefaultTopK();

        log.info("Starting MCQ generation for query '{}' (count={}, difficulty={}, topK={})",
                query, count, request.difficulty(), topK);

        List<ContextFragment> fragments = retrieve(query, topK);
        if (fragments.isEmpty()) {
            log.warn("No relevant context found for query '{}', cannot generate MCQs", query);
            return GenerationResult.empty(query, RunOutcome.NO_CONTEXT);
        }
        log.info("[{}] {} fragments for query '{}'", RunOutcome.RETRIEVED, fragments.size(), query);

        List<Mcq> mcqs = generationService.generate(fragments, count, request.difficulty());
        if (mcqs.isEmpty()) {
            log.warn("MCQ generation produced no candidates for query '{}'", query);
            return GenerationResult.empty(query, RunOutcome.GENERATION_EMPTY);
        }
        log.info("[{}] {} MCQs", RunOutcome.GENERATED, mcqs.size());

        List<CritiqueResult> critiques = critiqueService.critique(mcqs, fragments);
        log.info("[{}] {} critiques", RunOutcome.CRITIQUED, critiques.size());

        List<ValidationResult> validations = validationService.validate(mcqs, critiques, fragments);
        log.info("[{}] {} validations", RunOutcome.VALIDATED, validations.size());

        GenerationResult result = new GenerationResult(query, RunOutcome.AGGREGATED, mcqs, critiques, validations);
        log.info("Generation summary for '{}': total={}, valid={}, invalid={}, average quality={}",
                query, result.getTotalCount(), result.getValidCount(), result.getInvalidCount(),
                String.format("%.2f", result.getAverageQualityScore()));
        return result;
    }

    @Override
    public BatchGenerationResult runBatch(McqBatchRequest request) {
        List<String> queries = request.queries();
        int parallelism = Math.max(1, properties.getBatch().getParallelism());
        log.info("Batch MCQ generation: {} queries (parallelism={})", queries.size(), parallelism);

        List<GenerationResult> results = parallelism == 1
                ? runSequentially(request)
                : runConcurrently(request, parallelism);

        BatchGenerationResult batch = new BatchGenerationResult(results);
        log.info("Batch summary: queries={}, generated={}, valid={}, success rate={}%",
                batch.getQueriesProcessed(), batch.getTotalGenerated(), batch.getTotalValid(),
                String.format("%.1f", batch.getSuccessRate() * 100));
        return batch;
    }

    private List<GenerationResult> runSequentially(McqBatchRequest request) {
        List<GenerationResult> results = new ArrayList<>(request.queries().size());
        for (int i = 0; i < request.queries().size(); i++) {
            log.info("[Query {}/{}]", i + 1, request.queries().size());
            results.add(runIsolated(request, request.queries().get(i)));
        }
        return results;
    }

    // Each window of queries runs concurrently; results are joined in input order
    private List<GenerationResult> runConcurrently(McqBatchRequest request, int parallelism) {
        List<String> queries = request.queries();
        List<GenerationResult> results = new ArrayList<>(queries.size());

        for (int start = 0; start < queries.size(); start += parallelism) {
            List<CompletableFuture<GenerationResult>> window = queries
                    .subList(start, Math.min(start + parallelism, queries.size()))
                    .stream()
                    .map(query -> CompletableFuture.supplyAsync(() -> runIsolated(request, query), aiTaskExecutor))
                    .toList();
            window.forEach(future -> results.add(future.join()));
        }
        return results;
    }

    private GenerationResult runIsolated(McqBatchRequest request, String query) {
        try {
            return run(request.requestFor(query));
        } catch (RuntimeException e) {
            log.error("MCQ generation failed for query '{}'", query, e);
            return GenerationResult.empty(query, RunOutcome.FAILED);
        }
    }

    private List<ContextFragment> retrieve(String query, int topK) {
        try {
            List<ContextFragment> fragments = contextRetriever.retrieve(query, topK);
            return fragments != null ? fragments : List.of();
        } catch (RuntimeException e) {
            log.error("Context retrieval failed for query '{}'", query, e);
            return List.of();
        }
    }
}
