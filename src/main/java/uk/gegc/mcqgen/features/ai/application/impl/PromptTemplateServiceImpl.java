package uk.gegc.mcqgen.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.ai.application.PromptTemplateService;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classpath-backed prompt templates with an in-memory cache
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    static final String SYSTEM_PROMPT_TEMPLATE = "base/system-prompt.txt";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String loadPromptTemplate(String templateName) {
        if (templateName == null || templateName.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be empty");
        }
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    @Override
    public String render(String templateName, Map<String, String> variables) {
        String template = loadPromptTemplate(templateName);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder prompt = new StringBuilder(template.length());

        // Single pass over the template: substituted values are never rescanned
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = variables.containsKey(key)
                    ? Objects.requireNonNullElse(variables.get(key), "")
                    : matcher.group();
            matcher.appendReplacement(prompt, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(prompt);
        return prompt.toString();
    }

    @Override
    public String buildSystemPrompt() {
        return loadPromptTemplate(SYSTEM_PROMPT_TEMPLATE);
    }

    private String loadTemplateFromResources(String templateName) {
        Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
        try {
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new UncheckedIOException("Failed to load template: " + templateName, e);
        }
    }
}
