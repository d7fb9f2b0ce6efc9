package uk.gegc.edgeprompt.features.material.domain.model;

import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record MaterialAnalysis(
        UUID materialId,
        List<String> learningObjectives,
        List<ContentTemplate> templates,
        int wordCount,
        Instant processedAt
) {
}
