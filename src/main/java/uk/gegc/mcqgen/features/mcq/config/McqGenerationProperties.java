package uk.gegc.mcqgen.features.mcq.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the question generation pipeline.
 * Grounding, hallucination and revision thresholds are independent of each other.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "mcq")
public class McqGenerationProperties {

    /**
     * Questions requested per query when the request does not say
     */
    @Min(1)
    private int defaultCount = 5;

    /**
     * Fragments retrieved per query when the request does not say
     */
    @Min(1)
    private int defaultTopK = 5;

    @Valid
    private Generation generation = new Generation();

    @Valid
    private Critique critique = new Critique();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Retrieval retrieval = new Retrieval();

    @Valid
    private Batch batch = new Batch();

    @Data
    public static class Generation {
        private String template = "mcq/generation.txt";
        private Double temperature = 0.7;

        /**
         * Characters of the source fragment kept as the question's context snippet
         */
        private int snippetLength = 200;
    }

    @Data
    public static class Critique {
        private String template = "mcq/critique.txt";
        private Double temperature = 0.3;
    }

    @Data
    public static class Validation {
        private int minQuestionLength = 10;
        private int minExplanationLength = 10;

        /**
         * Grounding score below which a question is not considered grounded
         */
        private double groundingThreshold = 6.0;

        /**
         * Grounding score below which a question is flagged as hallucinated
         */
        private double hallucinationThreshold = 5.0;

        /**
         * Overall critique score from which a question with errors is still worth revising
         */
        private double revisionScoreThreshold = 7.0;
    }

    @Data
    public static class Retrieval {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double scoreThreshold = 0.7;
    }

    @Data
    public static class Batch {
        /**
         * Queries run at the same time by a batch; 1 runs them one after another
         */
        @Min(1)
        private int parallelism = 1;
    }
}
