package uk.gegc.edgeprompt.features.ai.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.ai.application.CompletionClient;
import uk.gegc.edgeprompt.features.ai.application.ContentGenerationService;
import uk.gegc.edgeprompt.features.ai.application.ContextTruncator;
import uk.gegc.edgeprompt.features.ai.application.PromptTemplateService;
import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;
import uk.gegc.edgeprompt.features.ai.domain.LanguageMode;
import uk.gegc.edgeprompt.features.ai.domain.QuestionTemplate;
import uk.gegc.edgeprompt.features.ai.infra.parser.JsonResponseExtractor;
import uk.gegc.edgeprompt.shared.exception.AiServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class ContentGenerationServiceImpl implements ContentGenerationService {

    static final String OBJECTIVES_TEMPLATE = "learning-objectives.txt";
    static final String TEMPLATES_TEMPLATE = "question-templates.txt";
    static final String QUESTION_TEMPLATE = "question-generation.txt";

    private final CompletionClient completionClient;
    private final PromptTemplateService promptTemplateService;
    private final ContextTruncator contextTruncator;
    private final JsonResponseExtractor jsonResponseExtractor;

    @Override
    public List<String> extractLearningObjectives(String content, String focusArea, LanguageMode languageMode) {
        try {
            String prompt = promptTemplateService.render(OBJECTIVES_TEMPLATE, Map.of(
                    "languageInstruction", languageMode.responseInstruction(),
                    "content", contextTruncator.truncate(content),
                    "focusArea", nullToEmpty(focusArea)
            ));
            JsonNode array = jsonResponseExtractor.extractArray(completionClient.complete(prompt));
            List<String> objectives = new ArrayList<>();
            for (JsonNode item : array) {
                String objective = item.isTextual() ? item.asText() : item.toString();
                if (!objective.isBlank()) {
                    objectives.add(objective.trim());
                }
            }
            log.debug("Extracted {} learning objectives", objectives.size());
            return objectives;
        } catch (Exception e) {
            log.error("Failed to extract objectives: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<ContentTemplate> suggestQuestionTemplates(String content,
                                                          List<String> objectives,
                                                          String focusArea,
                                                          LanguageMode languageMode) {
        try {
            String prompt = promptTemplateService.render(TEMPLATES_TEMPLATE, Map.of(
                    "languageInstruction", languageMode.responseInstruction(),
                    "content", contextTruncator.truncate(content),
                    "objectives", String.join("\n", objectives == null ? List.of() : objectives),
                    "focusArea", nullToEmpty(focusArea)
            ));
            JsonNode array = jsonResponseExtractor.extractArray(completionClient.complete(prompt));
            List<ContentTemplate> templates = new ArrayList<>();
            for (JsonNode item : array) {
                ContentTemplate template = jsonResponseExtractor.objectMapper().treeToValue(item, ContentTemplate.class);
                if (template == null || template.pattern() == null || template.pattern().isBlank()) {
                    log.warn("Skipping suggested template without a pattern: {}", item);
                    continue;
                }
                templates.add(template);
            }
            log.debug("Suggested {} question templates", templates.size());
            return templates;
        } catch (Exception e) {
            log.error("Failed to suggest templates: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public String generateQuestion(QuestionTemplate template,
                                   String context,
                                   LanguageMode languageMode,
                                   BooleanSupplier cancellationChecker) {
        if (template == null || template.pattern() == null || template.pattern().isBlank()) {
            throw new AiServiceException("Question template must have a pattern");
        }

        String prompt = promptTemplateService.render(QUESTION_TEMPLATE, Map.of(
                "languageInstruction", languageMode.questionInstruction(),
                "pattern", template.pattern(),
                "constraints", String.join("\n", template.constraints()),
                "context", contextTruncator.truncate(context)
        ));

        String response = completionClient.complete(prompt, cancellationChecker);
        return response.trim().replaceAll("^[\"']|[\"']$", "").trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
