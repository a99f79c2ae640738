package uk.gegc.mcqgen.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for text generation retry behavior
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Maximum number of attempts for a single completion call
     */
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 1000;

    /**
     * Cap for the backoff delay in milliseconds
     */
    private long maxDelayMs = 30000;

    /**
     * Jitter factor (0.0 = none, 0.25 = ±25% variation)
     */
    private double jitterFactor = 0.25;
}
