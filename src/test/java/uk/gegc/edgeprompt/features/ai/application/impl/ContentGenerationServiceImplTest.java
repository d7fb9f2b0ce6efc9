package uk.gegc.edgeprompt.features.ai.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.edgeprompt.BaseUnitTest;
import uk.gegc.edgeprompt.features.ai.application.CompletionClient;
import uk.gegc.edgeprompt.features.ai.application.ContextTruncator;
import uk.gegc.edgeprompt.features.ai.application.PromptTemplateService;
import uk.gegc.edgeprompt.features.ai.config.AiCompletionProperties;
import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;
import uk.gegc.edgeprompt.features.ai.domain.LanguageMode;
import uk.gegc.edgeprompt.features.ai.domain.QuestionTemplate;
import uk.gegc.edgeprompt.features.ai.infra.parser.JsonResponseExtractor;
import uk.gegc.edgeprompt.shared.exception.AiServiceException;

import java.util.List;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("ContentGenerationServiceImpl Tests")
class ContentGenerationServiceImplTest extends BaseUnitTest {

    @Mock
    private CompletionClient completionClient;

    private ContentGenerationServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ContentGenerationServiceImpl(
                completionClient,
                new PromptTemplateServiceImpl(new DefaultResourceLoader()),
                new ContextTruncator(new AiCompletionProperties()),
                new JsonResponseExtractor());
    }

    @Nested
    @DisplayName("extractLearningObjectives")
    class Objectives {

        @Test
        @DisplayName("parses the array embedded in the response")
        void parsesArray() {
            when(completionClient.complete(anyString()))
                    .thenReturn("Here are the objectives:\n[\"Explain evaporation\", \"Describe condensation\"]");

            List<String> objectives = service.extractLearningObjectives("Water cycle text", "Weather", LanguageMode.ENGLISH);

            assertThat(objectives).containsExactly("Explain evaporation", "Describe condensation");
        }

        @Test
        @DisplayName("a response without brackets yields an empty list")
        void noBrackets() {
            when(completionClient.complete(anyString())).thenReturn("Explain evaporation; describe condensation.");

            assertThat(service.extractLearningObjectives("text", "focus", LanguageMode.ENGLISH)).isEmpty();
        }

        @Test
        @DisplayName("a failing completion yields an empty list")
        void completionFails() {
            when(completionClient.complete(anyString())).thenThrow(new AiServiceException("down"));

            assertThat(service.extractLearningObjectives("text", "focus", LanguageMode.ENGLISH)).isEmpty();
        }

        @Test
        @DisplayName("prompt carries content, focus area and language instruction")
        void promptContents() {
            when(completionClient.complete(anyString())).thenReturn("[]");

            service.extractLearningObjectives("Plate tectonics", "Earthquakes", LanguageMode.SOURCE);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionClient).complete(prompt.capture());
            assertThat(prompt.getValue())
                    .contains("Plate tectonics")
                    .contains("Earthquakes")
                    .contains("Respond in the same language as the content.");
        }

        @Test
        @DisplayName("oversized content is truncated before prompting")
        void truncatesContent() {
            when(completionClient.complete(anyString())).thenReturn("[]");

            service.extractLearningObjectives("x".repeat(300_000), "", LanguageMode.ENGLISH);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionClient).complete(prompt.capture());
            assertThat(prompt.getValue()).contains("...[content truncated]...");
            assertThat(prompt.getValue().length()).isLessThan(64_000 + 1_000);
        }
    }

    @Nested
    @DisplayName("suggestQuestionTemplates")
    class Templates {

        @Test
        @DisplayName("maps entries and skips those without a pattern")
        void mapsAndSkips() {
            when(completionClient.complete(anyString())).thenReturn("""
                    ```json
                    [
                      {"pattern": "Why does {process} happen?", "constraints": ["one sentence"],
                       "targetGrade": "7", "subject": "Science", "learningObjectives": ["Explain evaporation"]},
                      {"constraints": ["missing pattern"]},
                      {"pattern": "  "}
                    ]
                    ```""");

            List<ContentTemplate> templates = service.suggestQuestionTemplates(
                    "text", List.of("Explain evaporation"), "Weather", LanguageMode.ENGLISH);

            assertThat(templates).hasSize(1);
            ContentTemplate template = templates.get(0);
            assertThat(template.pattern()).isEqualTo("Why does {process} happen?");
            assertThat(template.constraints()).containsExactly("one sentence");
            assertThat(template.targetGrade()).isEqualTo("7");
            assertThat(template.learningObjectives()).containsExactly("Explain evaporation");
        }

        @Test
        @DisplayName("unparseable response yields an empty list")
        void unparseable() {
            when(completionClient.complete(anyString())).thenReturn("[{ broken");

            assertThat(service.suggestQuestionTemplates("text", List.of(), "f", LanguageMode.ENGLISH)).isEmpty();
        }

        @Test
        @DisplayName("objectives are listed one per line in the prompt")
        void objectivesInPrompt() {
            when(completionClient.complete(anyString())).thenReturn("[]");

            service.suggestQuestionTemplates("text", List.of("First", "Second"), "f", LanguageMode.ENGLISH);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionClient).complete(prompt.capture());
            assertThat(prompt.getValue()).contains("First\nSecond").contains("Respond in English.");
        }
    }

    @Nested
    @DisplayName("generateQuestion")
    class Question {

        private final QuestionTemplate template =
                new QuestionTemplate("What is {concept}?", List.of("Use simple words", "End with a question mark"));

        @Test
        @DisplayName("strips one pair of surrounding quotes and whitespace")
        void stripsQuotes() {
            when(completionClient.complete(anyString(), any(BooleanSupplier.class)))
                    .thenReturn("\"What is photosynthesis?\"  ");

            assertThat(service.generateQuestion(template, "Plants", LanguageMode.ENGLISH))
                    .isEqualTo("What is photosynthesis?");
        }

        @Test
        @DisplayName("closing quote followed by a newline is still stripped")
        void stripsQuotesBeforeNewline() {
            when(completionClient.complete(anyString(), any(BooleanSupplier.class)))
                    .thenReturn("\n 'Why do leaves change colour?'\n");

            assertThat(service.generateQuestion(template, "Plants", LanguageMode.ENGLISH))
                    .isEqualTo("Why do leaves change colour?");
        }

        @Test
        @DisplayName("prompt carries pattern, constraints and question language")
        void promptContents() {
            when(completionClient.complete(anyString(), any(BooleanSupplier.class))).thenReturn("Q?");

            service.generateQuestion(template, "Plants make sugar", LanguageMode.SOURCE);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionClient).complete(prompt.capture(), any(BooleanSupplier.class));
            assertThat(prompt.getValue())
                    .contains("What is {concept}?")
                    .contains("Use simple words\nEnd with a question mark")
                    .contains("Plants make sugar")
                    .contains("Generate the question in the same language as the context.");
        }

        @Test
        @DisplayName("completion failures propagate")
        void failurePropagates() {
            when(completionClient.complete(anyString(), any(BooleanSupplier.class)))
                    .thenThrow(new AiServiceException("timed out"));

            assertThatThrownBy(() -> service.generateQuestion(template, "ctx", LanguageMode.ENGLISH))
                    .isInstanceOf(AiServiceException.class)
                    .hasMessage("timed out");
        }

        @Test
        @DisplayName("a template without a pattern is rejected")
        void missingPattern() {
            assertThatThrownBy(() -> service.generateQuestion(new QuestionTemplate(" ", null), "ctx", LanguageMode.ENGLISH))
                    .isInstanceOf(AiServiceException.class);
        }
    }

    @Nested
    @DisplayName("prompt rendering failures")
    class RenderingFailures {

        private ContentGenerationServiceImpl failingService;

        @BeforeEach
        void setUp() {
            PromptTemplateService brokenTemplates = mock(PromptTemplateService.class);
            when(brokenTemplates.render(anyString(), anyMap()))
                    .thenThrow(new AiServiceException("Failed to load prompt template: learning-objectives.txt"));
            failingService = new ContentGenerationServiceImpl(
                    completionClient,
                    brokenTemplates,
                    new ContextTruncator(new AiCompletionProperties()),
                    new JsonResponseExtractor());
        }

        @Test
        @DisplayName("objectives degrade to an empty list")
        void objectives() {
            assertThat(failingService.extractLearningObjectives("text", "focus", LanguageMode.ENGLISH)).isEmpty();
            verifyNoInteractions(completionClient);
        }

        @Test
        @DisplayName("templates degrade to an empty list")
        void templates() {
            assertThat(failingService.suggestQuestionTemplates("text", List.of("o"), "focus", LanguageMode.ENGLISH))
                    .isEmpty();
            verifyNoInteractions(completionClient);
        }
    }

    @Test
    @DisplayName("missing language mode does not escape the fail-soft operations")
    void nullLanguageMode() {
        assertThat(service.extractLearningObjectives("text", "focus", null)).isEmpty();
        assertThat(service.suggestQuestionTemplates("text", List.of(), "focus", null)).isEmpty();
    }
}
