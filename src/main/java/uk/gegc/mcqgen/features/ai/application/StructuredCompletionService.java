package uk.gegc.mcqgen.features.ai.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.mcqgen.features.ai.infra.parser.StructuredCompletion;

/**
 * Sends a prompt that mandates a JSON answer and reports the outcome as a tagged
 * result instead of throwing. Callers switch on {@link StructuredCompletion.Kind}
 * and apply their own fallback.
 */
public interface StructuredCompletionService {

    /**
     * Expect the model to answer with a JSON array.
     */
    StructuredCompletion<JsonNode> completeArray(String prompt, Double temperature);

    /**
     * Expect the model to answer with a single JSON object.
     */
    StructuredCompletion<JsonNode> completeObject(String prompt, Double temperature);
}
