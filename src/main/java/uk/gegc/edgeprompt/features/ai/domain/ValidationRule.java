package uk.gegc.edgeprompt.features.ai.domain;

public record ValidationRule(String criteria, double threshold, ScoreBoundaries boundaries) {
}
