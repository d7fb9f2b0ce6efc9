package uk.gegc.edgeprompt.features.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "edgeprompt.ai")
@Data
public class AiCompletionProperties {

    /**
     * Root of the OpenAI-compatible server, without the {@code /v1} suffix.
     */
    private String baseUrl = "http://localhost:1234";

    private String systemPrompt =
            "You are an educational assessment AI that provides structured feedback in JSON format.";

    /**
     * Deadline for a single completion call.
     */
    private Duration completionTimeout = Duration.ofSeconds(120);

    /**
     * Context budget for material text, estimated at four characters per token.
     */
    private int maxContextTokens = 16000;

    /**
     * Timeout of the {@code /v1/models} availability probe.
     */
    private Duration probeTimeout = Duration.ofSeconds(5);
}
