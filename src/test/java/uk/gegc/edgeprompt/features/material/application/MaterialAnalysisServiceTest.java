package uk.gegc.edgeprompt.features.material.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.edgeprompt.BaseUnitTest;
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
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("MaterialAnalysisService Tests")
class MaterialAnalysisServiceTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-14T09:30:00Z");

    @Mock
    private MaterialQueryService queryService;

    @Mock
    private MaterialRepository materialRepository;

    @Mock
    private ContentGenerationService contentGenerationService;

    private MaterialAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new MaterialAnalysisService(
                queryService, materialRepository, contentGenerationService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Material completedMaterial(String content, MaterialMetadata metadata) {
        Material material = new Material();
        material.setId(UUID.randomUUID());
        material.setProjectId(UUID.randomUUID());
        material.setTitle("Water cycle");
        material.setContent(content);
        material.setFocusArea("evaporation");
        material.setMetadata(metadata);
        material.setStatus(MaterialStatus.COMPLETED);
        return material;
    }

    @Test
    @DisplayName("stores objectives, templates, word count and timestamp in metadata")
    void analyzes() {
        MaterialMetadata metadata = MaterialMetadata.builder().title("Water cycle").grade("5").build();
        Material material = completedMaterial("  Water evaporates,\n condenses and\tfalls as rain.  ", metadata);
        ContentTemplate template = new ContentTemplate(
                "Explain how {process} works", List.of("one paragraph"), "5", "science", List.of("describe evaporation"));
        when(queryService.getMaterial(material.getId())).thenReturn(material);
        when(contentGenerationService.extractLearningObjectives(material.getContent(), "evaporation", LanguageMode.ENGLISH))
                .thenReturn(List.of("describe evaporation"));
        when(contentGenerationService.suggestQuestionTemplates(
                material.getContent(), List.of("describe evaporation"), "evaporation", LanguageMode.ENGLISH))
                .thenReturn(List.of(template));

        MaterialAnalysis analysis = service.analyzeMaterial(material.getId());

        assertThat(analysis.materialId()).isEqualTo(material.getId());
        assertThat(analysis.learningObjectives()).containsExactly("describe evaporation");
        assertThat(analysis.templates()).containsExactly(template);
        assertThat(analysis.wordCount()).isEqualTo(7);
        assertThat(analysis.processedAt()).isEqualTo(NOW);

        ArgumentCaptor<Material> saved = ArgumentCaptor.forClass(Material.class);
        verify(materialRepository).save(saved.capture());
        MaterialMetadata stored = saved.getValue().getMetadata();
        assertThat(stored.getTitle()).isEqualTo("Water cycle");
        assertThat(stored.getGrade()).isEqualTo("5");
        assertThat(stored.getLearningObjectives()).containsExactly("describe evaporation");
        assertThat(stored.getTemplates()).containsExactly(template);
        assertThat(stored.getWordCount()).isEqualTo(7);
        assertThat(stored.getProcessedAt()).isEqualTo(NOW);
        assertThat(metadata.getWordCount()).as("caller metadata is not mutated").isNull();
    }

    @Test
    @DisplayName("source-language flag switches the language mode")
    void sourceLanguage() {
        Material material = completedMaterial("Das Wasser verdunstet.",
                MaterialMetadata.builder().useSourceLanguage(true).build());
        when(queryService.getMaterial(material.getId())).thenReturn(material);
        when(contentGenerationService.extractLearningObjectives(anyString(), anyString(), eq(LanguageMode.SOURCE)))
                .thenReturn(List.of());
        when(contentGenerationService.suggestQuestionTemplates(anyString(), anyList(), anyString(), eq(LanguageMode.SOURCE)))
                .thenReturn(List.of());

        MaterialAnalysis analysis = service.analyzeMaterial(material.getId());

        assertThat(analysis.learningObjectives()).isEmpty();
        assertThat(analysis.templates()).isEmpty();
        assertThat(analysis.wordCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("material that has not completed processing is refused")
    void notCompleted() {
        Material material = completedMaterial("", new MaterialMetadata());
        material.setStatus(MaterialStatus.ERROR);
        when(queryService.getMaterial(material.getId())).thenReturn(material);

        assertThatThrownBy(() -> service.analyzeMaterial(material.getId()))
                .isInstanceOf(MaterialNotProcessedException.class)
                .hasMessageContaining("is error");
        verifyNoInteractions(contentGenerationService);
        verify(materialRepository, never()).save(any());
    }

    @Test
    @DisplayName("word count splits on any whitespace")
    void countWords() {
        assertThat(MaterialAnalysisService.countWords(null)).isZero();
        assertThat(MaterialAnalysisService.countWords("   \n\t ")).isZero();
        assertThat(MaterialAnalysisService.countWords("one")).isEqualTo(1);
        assertThat(MaterialAnalysisService.countWords(" one  two\n\nthree\tfour ")).isEqualTo(4);
    }
}
