package uk.gegc.edgeprompt.features.material.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MaterialSource Tests")
class MaterialSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("staged file becomes a file-based source typed by its extension")
    void ofFile() {
        Path staged = tempDir.resolve("8d2e.docx");

        MaterialSource source = MaterialSource.ofFile(staged, null);

        assertThat(source.type()).isEqualTo("docx");
        assertThat(source.content()).isEqualTo(staged.toAbsolutePath().toString());
        assertThat(source.isFileBased()).isTrue();
        assertThat(source.metadata()).isNotNull();
    }

    @Test
    @DisplayName("inline text and URLs are not file-based")
    void inlineSources() {
        assertThat(MaterialSource.ofText("Hello world", null).isFileBased()).isFalse();
        assertThat(new MaterialSource("url", "https://example.org/notes", null).isFileBased()).isFalse();
        assertThat(new MaterialSource("text", "", null).isFileBased()).isFalse();
        assertThat(new MaterialSource("text", null, null).isFileBased()).isFalse();
    }

    @Test
    @DisplayName("multi-line text that starts like a path is still inline")
    void multiLineText() {
        String text = tempDir.toAbsolutePath() + "\nis where the notes live";

        assertThat(MaterialSource.ofText(text, null).isFileBased()).isFalse();
    }

    @Test
    @DisplayName("withContent keeps type and metadata")
    void withContent() {
        MaterialMetadata metadata = MaterialMetadata.builder().title("Notes").build();
        MaterialSource source = new MaterialSource("pdf", "/tmp/a.pdf", metadata).withContent("/data/material.pdf");

        assertThat(source.type()).isEqualTo("pdf");
        assertThat(source.content()).isEqualTo("/data/material.pdf");
        assertThat(source.metadata()).isSameAs(metadata);
    }
}
