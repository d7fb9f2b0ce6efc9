package uk.gegc.edgeprompt.features.ai.domain;

/**
 * Outcome of grading one answer. {@code score} lies within the rule's boundaries,
 * except for the {@link #failed(String)} result which always scores 0.
 */
public record ValidationResult(boolean isValid, double score, String feedback) {

    public static ValidationResult failed(String reason) {
        return new ValidationResult(false, 0, "Validation failed: " + reason);
    }
}
