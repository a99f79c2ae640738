package uk.gegc.mcqgen.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.ai.application.PromptTemplateService;
import uk.gegc.mcqgen.features.ai.application.TextGenerationClient;
import uk.gegc.mcqgen.shared.config.AiRateLimitConfig;
import uk.gegc.mcqgen.shared.exception.AiServiceException;

import java.time.Duration;
import java.time.Instant;

/**
 * Spring AI implementation of TextGenerationClient.
 * Sends the shared system prompt plus the caller's prompt through ChatClient,
 * retrying with exponential backoff when the provider reports a rate limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiTextGenerationClient implements TextGenerationClient {

    private final ChatClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final AiRateLimitConfig rateLimitConfig;

    @Override
    public String complete(String prompt, Double temperature) {
        if (prompt == null || prompt.trim().isEmpty()) {
            throw new AiServiceException("Prompt cannot be null or empty");
        }

        String systemPrompt = promptTemplateService.buildSystemPrompt();
        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (true) {
            Instant start = Instant.now();
            try {
                String text = attemptCompletion(systemPrompt, prompt, temperature);
                log.debug("Completion received in {} ms ({} chars)",
                        Duration.between(start, Instant.now()).toMillis(), text.length());
                return text;
            } catch (Exception e) {
                boolean lastAttempt = retryCount >= maxRetries - 1;
                if (lastAttempt) {
                    log.error("Completion failed after {} attempts", maxRetries, e);
                    if (e instanceof AiServiceException aiServiceException) {
                        throw aiServiceException;
                    }
                    throw new AiServiceException("Failed to get AI response after " + maxRetries
                            + " attempts: " + e.getMessage(), e);
                }

                if (isRateLimitError(e)) {
                    long delayMs = calculateBackoffDelay(retryCount);
                    log.warn("Rate limit hit (attempt {}). Waiting {} ms before retry", retryCount + 1, delayMs);
                    sleepForRateLimit(delayMs);
                } else {
                    log.warn("Completion attempt {} failed: {}", retryCount + 1, e.getMessage());
                }
                retryCount++;
            }
        }
    }

    private String attemptCompletion(String systemPrompt, String prompt, Double temperature) {
        ChatClient.ChatClientRequestSpec request = chatClient.prompt()
                .system(systemPrompt)
                .user(prompt);
        if (temperature != null) {
            request = request.options(ChatOptions.builder().temperature(temperature).build());
        }

        ChatResponse response = request.call().chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AiServiceException("No response received from AI service");
        }

        String text = response.getResult().getOutput().getText();
        if (text == null || text.trim().isEmpty()) {
            throw new AiServiceException("Empty response received from AI service");
        }
        return text;
    }

    /**
     * Check if the exception is a rate limit error (429)
     */
    boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }

        return message.contains("429") ||
               message.contains("rate limit") ||
               message.contains("rate_limit_exceeded") ||
               message.contains("Too Many Requests");
    }

    /**
     * Exponential backoff with jitter, capped at the configured maximum
     */
    long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = rateLimitConfig.getBaseDelayMs() * (long) Math.pow(2, retryCount);

        double jitterRange = rateLimitConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);

        long delayWithJitter = (long) (exponentialDelay * jitter);

        return Math.min(delayWithJitter, rateLimitConfig.getMaxDelayMs());
    }

    /**
     * Overridden in tests to avoid actual sleeping
     */
    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting for rate limit", ie);
        }
    }
}
