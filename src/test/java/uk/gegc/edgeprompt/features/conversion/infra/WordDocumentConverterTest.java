package uk.gegc.edgeprompt.features.conversion.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionFailedException;
import uk.gegc.edgeprompt.util.TestDocuments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WordDocumentConverter Tests")
class WordDocumentConverterTest {

    @TempDir
    Path tempDir;

    private final WordDocumentConverter converter = new WordDocumentConverter();

    @Test
    @DisplayName("supports doc and docx")
    void supports() {
        assertThat(converter.supports("doc")).isTrue();
        assertThat(converter.supports("docx")).isTrue();
        assertThat(converter.supports("pdf")).isFalse();
    }

    @Test
    @DisplayName("extracts paragraph text from a .docx")
    void docx() throws IOException {
        Path docx = TestDocuments.docx(tempDir.resolve("material.docx"),
                "Fractions describe parts of a whole.", "Denominators must not be zero.");

        String text = converter.convert(docx.toString()).text();

        assertThat(text)
                .contains("Fractions describe parts of a whole.")
                .contains("Denominators must not be zero.");
    }

    @Test
    @DisplayName("an OOXML file stored with a .doc name is still read")
    void docxBytesWithDocName() throws IOException {
        Path misnamed = TestDocuments.docx(tempDir.resolve("material.doc"), "Container decides the parser");

        assertThat(converter.convert(misnamed.toString()).text()).contains("Container decides the parser");
    }

    @Test
    @DisplayName("an unreadable compound file fails with a Word processing error")
    void brokenCompoundFile() throws IOException {
        Path doc = Files.write(tempDir.resolve("material.doc"), TestDocuments.compoundFileHeader());

        assertThatThrownBy(() -> converter.convert(doc.toString()))
                .isInstanceOf(ConversionFailedException.class)
                .hasMessageStartingWith("Failed to process Word file");
    }

    @Test
    @DisplayName("plain text bytes are not a Word document")
    void plainText() throws IOException {
        Path doc = Files.writeString(tempDir.resolve("material.docx"), "just text");

        assertThatThrownBy(() -> converter.convert(doc.toString()))
                .isInstanceOf(ConversionFailedException.class)
                .hasMessageStartingWith("Failed to process Word file");
    }
}
