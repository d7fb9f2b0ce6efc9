package uk.gegc.edgeprompt.features.ai.domain;

import java.util.List;

public record QuestionTemplate(String pattern, List<String> constraints) {

    public QuestionTemplate {
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
