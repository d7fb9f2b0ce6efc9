package uk.gegc.edgeprompt.features.ai.domain;

import java.util.List;
import java.util.Map;

/**
 * Teacher-defined grading instructions attached to a generated question.
 */
public record Rubric(
        Map<String, Double> criteriaWeights,
        List<String> validationChecks,
        String scoringGuidelines
) {

    public Rubric {
        criteriaWeights = criteriaWeights == null ? Map.of() : Map.copyOf(criteriaWeights);
        validationChecks = validationChecks == null ? List.of() : List.copyOf(validationChecks);
    }
}
