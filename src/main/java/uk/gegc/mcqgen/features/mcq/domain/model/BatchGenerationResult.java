package uk.gegc.mcqgen.features.mcq.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Results of a multi-query run with the aggregate counters, computed once the
 * per-query results are complete.
 */
@Getter
@ToString
@JsonPropertyOrder({"queries_processed", "total_generated", "total_valid", "success_rate", "results"})
public final class BatchGenerationResult {

    @JsonProperty("results")
    private final List<GenerationResult> results;

    @JsonProperty("total_generated")
    private final int totalGenerated;

    @JsonProperty("total_valid")
    private final int totalValid;

    @JsonProperty("success_rate")
    private final double successRate;

    public BatchGenerationResult(List<GenerationResult> results) {
        this.results = results == null ? List.of() : List.copyOf(results);
        this.totalGenerated = this.results.stream().mapToInt(GenerationResult::getTotalCount).sum();
        this.totalValid = this.results.stream().mapToInt(GenerationResult::getValidCount).sum();
        this.successRate = totalGenerated == 0 ? 0.0 : (double) totalValid / totalGenerated;
    }

    @JsonProperty("queries_processed")
    public int getQueriesProcessed() {
        return results.size();
    }
}
