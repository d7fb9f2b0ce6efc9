package uk.gegc.edgeprompt.features.ai.infra.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.ai.application.CompletionClient;
import uk.gegc.edgeprompt.features.ai.config.AiCompletionProperties;

/**
 * Reports whether the completion server answers its model listing.
 */
@Component("completionEndpoint")
public class CompletionEndpointHealthIndicator implements HealthIndicator {

    private final CompletionClient completionClient;
    private final AiCompletionProperties properties;

    public CompletionEndpointHealthIndicator(CompletionClient completionClient, AiCompletionProperties properties) {
        this.completionClient = completionClient;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Health.Builder builder = completionClient.isAvailable() ? Health.up() : Health.down();
        return builder.withDetail("baseUrl", properties.getBaseUrl()).build();
    }
}
