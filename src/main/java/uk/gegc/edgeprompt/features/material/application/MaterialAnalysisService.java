package uk.gegc.edgeprompt.features.material.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.ai.application.ContentGenerationService;
import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;
import uk.gegc.edgeprompt.features.ai.domain.LanguageMode;
import uk.gegc.edgeprompt.features.material.domain.model.Material;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialAnalysis;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialMetadata;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialStatus;
import uk.gegc.edgeprompt.features.material.domain.repository.MaterialRepository;
import uk.gegc.edgeprompt.shared.exception.MaterialNotProcessedException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Derives learning objectives and question templates for a processed material
 * and stores them in its metadata.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialAnalysisService {

    private final MaterialQueryService materialQueryService;
    private final MaterialRepository materialRepository;
    private final ContentGenerationService contentGenerationService;
    private final Clock clock;

    public MaterialAnalysis analyzeMaterial(UUID materialId) {
        Material material = materialQueryService.getMaterial(materialId);
        if (material.getStatus() != MaterialStatus.COMPLETED) {
            throw new MaterialNotProcessedException(materialId, material.getStatus().getValue());
        }

        MaterialMetadata metadata = material.getMetadata() != null ? material.getMetadata().copy() : new MaterialMetadata();
        LanguageMode languageMode = LanguageMode.fromSourceLanguageFlag(metadata.getUseSourceLanguage());
        String content = material.getContent();

        List<String> objectives = contentGenerationService.extractLearningObjectives(
                content, material.getFocusArea(), languageMode);
        List<ContentTemplate> templates = contentGenerationService.suggestQuestionTemplates(
                content, objectives, material.getFocusArea(), languageMode);
        int wordCount = countWords(content);
        Instant processedAt = clock.instant();

        metadata.setLearningObjectives(new ArrayList<>(objectives));
        metadata.setTemplates(new ArrayList<>(templates));
        metadata.setWordCount(wordCount);
        metadata.setProcessedAt(processedAt);
        material.setMetadata(metadata);
        materialRepository.save(material);

        log.info("Analyzed material {}: {} objectives, {} templates, {} words",
                materialId, objectives.size(), templates.size(), wordCount);
        return new MaterialAnalysis(materialId, objectives, templates, wordCount, processedAt);
    }

    static int countWords(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }
}
