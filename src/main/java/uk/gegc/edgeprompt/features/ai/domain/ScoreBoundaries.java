package uk.gegc.edgeprompt.features.ai.domain;

/**
 * Inclusive score range of a validation rule.
 */
public record ScoreBoundaries(double min, double max) {

    public ScoreBoundaries {
        if (min > max) {
            throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
        }
    }

    public double clamp(double score) {
        return Math.max(min, Math.min(max, score));
    }
}
