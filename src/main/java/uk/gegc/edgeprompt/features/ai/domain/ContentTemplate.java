package uk.gegc.edgeprompt.features.ai.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Question pattern suggested for a material. The pattern carries {@code {placeholder}} markers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentTemplate(
        String pattern,
        List<String> constraints,
        String targetGrade,
        String subject,
        List<String> learningObjectives
) {

    public ContentTemplate {
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        learningObjectives = learningObjectives == null ? List.of() : List.copyOf(learningObjectives);
    }

    public QuestionTemplate toQuestionTemplate() {
        return new QuestionTemplate(pattern, constraints);
    }
}
