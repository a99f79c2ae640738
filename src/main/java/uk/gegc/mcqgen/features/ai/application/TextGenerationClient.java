package uk.gegc.mcqgen.features.ai.application;

/**
 * Free-form text completion backed by an external language model.
 * <p>
 * Keeps vendor specifics out of the generation and critique stages and lets
 * tests replace the model with canned responses.
 */
public interface TextGenerationClient {

    /**
     * Complete a prompt with the model's default sampling settings.
     *
     * @param prompt the full user prompt
     * @return the raw text returned by the model
     * @throws uk.gegc.mcqgen.shared.exception.AiServiceException if the service is unreachable,
     *                                                            times out or returns an error
     */
    default String complete(String prompt) {
        return complete(prompt, null);
    }

    /**
     * Complete a prompt with an explicit sampling temperature.
     *
     * @param prompt      the full user prompt
     * @param temperature sampling temperature, or null for the model default
     * @return the raw text returned by the model
     * @throws uk.gegc.mcqgen.shared.exception.AiServiceException on transport, timeout or service errors
     */
    String complete(String prompt, Double temperature);
}
