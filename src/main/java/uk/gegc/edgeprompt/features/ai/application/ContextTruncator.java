package uk.gegc.edgeprompt.features.ai.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.ai.config.AiCompletionProperties;

/**
 * Keeps material text inside the model's context window.
 * Over-budget text keeps its first and last third of the budget around a truncation marker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextTruncator {

    public static final int CHARS_PER_TOKEN = 4;
    public static final String TRUNCATION_MARKER = "\n...[content truncated]...\n";

    private final AiCompletionProperties properties;

    public String truncate(String content) {
        if (content == null) {
            return "";
        }
        int maxChars = properties.getMaxContextTokens() * CHARS_PER_TOKEN;
        if (content.length() <= maxChars) {
            return content;
        }

        int third = maxChars / 3;
        log.debug("Truncating content from {} to about {} characters", content.length(), 2 * third);
        return content.substring(0, third) + TRUNCATION_MARKER + content.substring(content.length() - third);
    }

    /**
     * Rough token estimate using the same ratio as {@link #truncate(String)}.
     */
    public int estimateTokens(String content) {
        return content == null ? 0 : (int) Math.ceil(content.length() / (double) CHARS_PER_TOKEN);
    }
}
