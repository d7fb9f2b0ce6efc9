package uk.gegc.edgeprompt.features.ai.application;

import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;
import uk.gegc.edgeprompt.features.ai.domain.LanguageMode;
import uk.gegc.edgeprompt.features.ai.domain.QuestionTemplate;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * LLM-backed generation from material text.
 */
public interface ContentGenerationService {

    /**
     * @return the objectives, or an empty list if the model fails or answers without a JSON array
     */
    List<String> extractLearningObjectives(String content, String focusArea, LanguageMode languageMode);

    /**
     * @return suggested templates, or an empty list on failure; entries without a pattern are dropped
     */
    List<ContentTemplate> suggestQuestionTemplates(String content,
                                                   List<String> objectives,
                                                   String focusArea,
                                                   LanguageMode languageMode);

    /**
     * Generates one question. Failures propagate to the caller.
     */
    default String generateQuestion(QuestionTemplate template, String context, LanguageMode languageMode) {
        return generateQuestion(template, context, languageMode, () -> false);
    }

    String generateQuestion(QuestionTemplate template,
                            String context,
                            LanguageMode languageMode,
                            BooleanSupplier cancellationChecker);
}
