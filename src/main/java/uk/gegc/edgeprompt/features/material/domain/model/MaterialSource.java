package uk.gegc.edgeprompt.features.material.domain.model;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Inbound material before processing.
 *
 * @param type     type tag such as {@code pdf}, {@code .docx}, {@code text} or {@code url}
 * @param content  inline text, an absolute path to a staged upload, or a URL
 * @param metadata caller attributes, copied onto the created material
 */
public record MaterialSource(String type, String content, MaterialMetadata metadata) {

    public MaterialSource {
        metadata = metadata == null ? new MaterialMetadata() : metadata;
    }

    public static MaterialSource ofFile(Path stagedFile, MaterialMetadata metadata) {
        String name = stagedFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String type = dot >= 0 ? name.substring(dot + 1) : "";
        return new MaterialSource(type, stagedFile.toAbsolutePath().toString(), metadata);
    }

    public static MaterialSource ofText(String text, MaterialMetadata metadata) {
        return new MaterialSource("text", text, metadata);
    }

    public MaterialSource withContent(String newContent) {
        return new MaterialSource(type, newContent, metadata);
    }

    /**
     * True when {@code content} is a single-line absolute path, i.e. an uploaded file.
     */
    public boolean isFileBased() {
        if (content == null || content.isBlank() || content.contains("\n") || content.contains("\r")) {
            return false;
        }
        try {
            return Path.of(content).isAbsolute();
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
