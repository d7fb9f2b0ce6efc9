package uk.gegc.edgeprompt.features.conversion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Limits applied when downloading {@code url} materials.
 */
@Configuration
@ConfigurationProperties(prefix = "link.fetch")
@Data
public class LinkFetchConfig {

    /**
     * Connection timeout in milliseconds.
     */
    private int connectTimeoutMs = 3000;

    /**
     * Read timeout in milliseconds.
     */
    private int readTimeoutMs = 10000;

    /**
     * Largest body accepted, in bytes (5 MB).
     */
    private long maxContentSizeBytes = 5_242_880;

    private int maxRedirects = 5;

    private String userAgent = "EdgePrompt-Fetcher/1.0";

    /**
     * Reject loopback, private and link-local targets and non-standard ports.
     * Only switched off for local development against a stub server.
     */
    private boolean ssrfProtectionEnabled = true;
}
