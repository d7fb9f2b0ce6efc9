package uk.gegc.edgeprompt.features.ai.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.shared.exception.AIResponseParseException;

/**
 * Locates the JSON payload inside free-form model output.
 * Models tend to wrap JSON in prose or code fences, so the outermost bracket pair is taken.
 */
@Component
@Slf4j
public class JsonResponseExtractor {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses the text between the first {@code [} and the last {@code ]}.
     */
    public JsonNode extractArray(String response) {
        JsonNode node = extract(response, '[', ']', "array");
        if (!node.isArray()) {
            throw new AIResponseParseException("Expected a JSON array in AI response");
        }
        return node;
    }

    /**
     * Parses the text between the first <code>{</code> and the last <code>}</code>.
     */
    public JsonNode extractObject(String response) {
        JsonNode node = extract(response, '{', '}', "object");
        if (!node.isObject()) {
            throw new AIResponseParseException("Expected a JSON object in AI response");
        }
        return node;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private JsonNode extract(String response, char open, char close, String kind) {
        if (response == null) {
            throw new AIResponseParseException("AI response is empty");
        }
        int start = response.indexOf(open);
        int end = response.lastIndexOf(close);
        if (start < 0 || end < start) {
            throw new AIResponseParseException("No JSON " + kind + " found in response");
        }
        try {
            return objectMapper.readTree(response.substring(start, end + 1));
        } catch (Exception e) {
            log.debug("Unparseable JSON {} in AI response: {}", kind, response);
            throw new AIResponseParseException("Failed to parse JSON " + kind + ": " + e.getMessage(), e);
        }
    }
}
