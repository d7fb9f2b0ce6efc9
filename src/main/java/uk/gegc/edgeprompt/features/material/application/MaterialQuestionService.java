package uk.gegc.edgeprompt.features.material.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.ai.application.ContentGenerationService;
import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;
import uk.gegc.edgeprompt.features.ai.domain.LanguageMode;
import uk.gegc.edgeprompt.features.ai.domain.Rubric;
import uk.gegc.edgeprompt.features.material.domain.model.GeneratedQuestion;
import uk.gegc.edgeprompt.features.material.domain.model.Material;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialMetadata;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialStatus;
import uk.gegc.edgeprompt.shared.exception.MaterialNotProcessedException;
import uk.gegc.edgeprompt.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialQuestionService {

    private final MaterialQueryService materialQueryService;
    private final ContentGenerationService contentGenerationService;
    private final Clock clock;

    /**
     * Generates a question from the template stored at {@code templateIndex} in the material's metadata.
     *
     * @throws ResourceNotFoundException if the material or the template does not exist
     */
    public GeneratedQuestion generateQuestion(UUID materialId, int templateIndex, Rubric rubric) {
        Material material = materialQueryService.getMaterial(materialId);
        if (material.getStatus() != MaterialStatus.COMPLETED) {
            throw new MaterialNotProcessedException(materialId, material.getStatus().getValue());
        }

        MaterialMetadata metadata = material.getMetadata() != null ? material.getMetadata() : new MaterialMetadata();
        List<ContentTemplate> templates = metadata.getTemplates() != null ? metadata.getTemplates() : List.of();
        if (templateIndex < 0 || templateIndex >= templates.size()) {
            throw new ResourceNotFoundException(
                    "Template " + templateIndex + " not found for material " + materialId
                            + " (" + templates.size() + " templates)");
        }

        String question = contentGenerationService.generateQuestion(
                templates.get(templateIndex).toQuestionTemplate(),
                material.getContent(),
                LanguageMode.fromSourceLanguageFlag(metadata.getUseSourceLanguage()));

        log.info("Generated question for material {} from template {}", materialId, templateIndex);
        return new GeneratedQuestion(materialId, templateIndex, question, rubric, clock.instant());
    }
}
