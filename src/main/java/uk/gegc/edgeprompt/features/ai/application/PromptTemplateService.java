package uk.gegc.edgeprompt.features.ai.application;

import java.util.Map;

/**
 * Loads prompt templates from {@code classpath:prompts/} and fills their {@code {name}} placeholders.
 */
public interface PromptTemplateService {

    String loadPromptTemplate(String templateName);

    /**
     * Substitutes placeholders in a single pass, so placeholder-like text inside values
     * (material content, template patterns) is left untouched. Unknown placeholders stay as they are.
     */
    String render(String templateName, Map<String, String> variables);
}
