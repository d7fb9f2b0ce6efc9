package uk.gegc.edgeprompt.features.conversion.infra;

import uk.gegc.edgeprompt.features.conversion.domain.ConversionFailedException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Reads material files that were moved into permanent storage before conversion.
 */
final class StoredFileReader {

    private StoredFileReader() {
    }

    /**
     * True when the content is a single-line absolute path rather than inline text.
     */
    static boolean isAbsolutePath(String content) {
        if (content == null || content.isBlank() || content.indexOf('\n') >= 0 || content.indexOf('\r') >= 0) {
            return false;
        }
        try {
            return Path.of(content).isAbsolute();
        } catch (InvalidPathException e) {
            return false;
        }
    }

    static byte[] readBytes(String path) {
        if (path == null || path.isBlank()) {
            throw new ConversionFailedException("No file path provided");
        }
        try {
            return Files.readAllBytes(Path.of(path));
        } catch (IOException | InvalidPathException e) {
            throw new ConversionFailedException("Cannot read material file " + path + ": " + e.getMessage(), e);
        }
    }

    static String readUtf8(String path) {
        return new String(readBytes(path), StandardCharsets.UTF_8);
    }
}
