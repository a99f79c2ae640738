package uk.gegc.mcqgen.features.mcq.domain.model;

/**
 * States of a single pipeline run.
 */
public enum RunOutcome {

    RETRIEVED,
    GENERATED,
    CRITIQUED,
    VALIDATED,

    /**
     * Terminal: all four stages ran and the result was aggregated
     */
    AGGREGATED,

    /**
     * Terminal: retrieval returned no fragment
     */
    NO_CONTEXT,

    /**
     * Terminal: the generation stage produced no candidate
     */
    GENERATION_EMPTY,

    /**
     * Terminal: the run aborted with an unexpected error (batch isolation only)
     */
    FAILED
}
