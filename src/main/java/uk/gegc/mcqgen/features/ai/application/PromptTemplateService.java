package uk.gegc.mcqgen.features.ai.application;

import java.util.Map;

/**
 * Service for loading and filling the prompt templates shipped under {@code classpath:prompts/}
 */
public interface PromptTemplateService {

    /**
     * Load a prompt template from resources
     *
     * @param templateName path of the template relative to the prompts folder
     * @return the template content
     */
    String loadPromptTemplate(String templateName);

    /**
     * Load a template and replace each {@code {key}} placeholder with its value
     *
     * @param templateName path of the template relative to the prompts folder
     * @param variables    placeholder values
     * @return the filled prompt
     */
    String render(String templateName, Map<String, String> variables);

    /**
     * System prompt sent with every completion
     */
    String buildSystemPrompt();
}
