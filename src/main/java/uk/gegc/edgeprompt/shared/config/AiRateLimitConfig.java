package uk.gegc.edgeprompt.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry and backoff settings for calls to the completion endpoint.
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Total attempts per completion call (1 disables retrying)
     */
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 1000;

    /**
     * Cap for a single backoff delay in milliseconds
     */
    private long maxDelayMs = 30000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    private double jitterFactor = 0.25;
}
