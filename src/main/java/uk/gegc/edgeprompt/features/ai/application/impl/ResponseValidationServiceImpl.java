package uk.gegc.edgeprompt.features.ai.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.ai.application.CompletionClient;
import uk.gegc.edgeprompt.features.ai.application.PromptTemplateService;
import uk.gegc.edgeprompt.features.ai.application.ResponseValidationService;
import uk.gegc.edgeprompt.features.ai.domain.ScoreBoundaries;
import uk.gegc.edgeprompt.features.ai.domain.ValidationResult;
import uk.gegc.edgeprompt.features.ai.domain.ValidationRule;
import uk.gegc.edgeprompt.features.ai.infra.parser.JsonResponseExtractor;
import uk.gegc.edgeprompt.shared.exception.AIResponseParseException;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseValidationServiceImpl implements ResponseValidationService {

    static final String VALIDATION_TEMPLATE = "response-validation.txt";

    private final CompletionClient completionClient;
    private final PromptTemplateService promptTemplateService;
    private final JsonResponseExtractor jsonResponseExtractor;

    @Override
    public ValidationResult validateResponse(String question, String answer, ValidationRule rule) {
        try {
            ScoreBoundaries boundaries = rule.boundaries();
            String prompt = promptTemplateService.render(VALIDATION_TEMPLATE, Map.of(
                    "question", String.valueOf(question),
                    "answer", String.valueOf(answer),
                    "criteria", String.valueOf(rule.criteria()),
                    "threshold", formatNumber(rule.threshold()),
                    "min", formatNumber(boundaries.min()),
                    "max", formatNumber(boundaries.max())
            ));

            JsonNode result = jsonResponseExtractor.extractObject(completionClient.complete(prompt));
            JsonNode scoreNode = result.get("score");
            if (scoreNode == null || !scoreNode.isNumber()) {
                throw new AIResponseParseException("Response has no numeric score");
            }

            double score = boundaries.clamp(scoreNode.asDouble());
            if (score != scoreNode.asDouble()) {
                log.warn("Score {} outside [{}, {}], clamped to {}",
                        scoreNode.asDouble(), boundaries.min(), boundaries.max(), score);
            }
            return new ValidationResult(
                    result.path("isValid").asBoolean(false),
                    score,
                    result.path("feedback").asText("")
            );
        } catch (Exception e) {
            log.error("Validation error: {}", e.getMessage());
            return ValidationResult.failed(e.getMessage() != null ? e.getMessage() : "Unknown error");
        }
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
