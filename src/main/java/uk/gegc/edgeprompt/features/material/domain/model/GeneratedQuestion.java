package uk.gegc.edgeprompt.features.material.domain.model;

import uk.gegc.edgeprompt.features.ai.domain.Rubric;

import java.time.Instant;
import java.util.UUID;

/**
 * A question generated from one of a material's templates. Not persisted.
 */
public record GeneratedQuestion(
        UUID materialId,
        int templateIndex,
        String question,
        Rubric rubric,
        Instant generatedAt
) {
}
