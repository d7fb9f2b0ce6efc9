package uk.gegc.edgeprompt.features.upload.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.upload.config.UploadValidationProperties;
import uk.gegc.edgeprompt.shared.exception.UploadValidationException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Checks a staged upload by its bytes, not only by its declared name.
 * A rejected upload is deleted from disk before the exception is thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadValidationService {

    static final String MIME_MARKDOWN = "text/markdown";
    static final String MIME_DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    static final String MIME_DOC = "application/msword";

    private static final String MIME_OCTET_STREAM = "application/octet-stream";
    private static final String MIME_TEXT_PLAIN = "text/plain";
    private static final Set<String> ZIP_CONTAINER_TYPES = Set.of("application/zip", "application/x-tika-ooxml");
    private static final Set<String> OLE2_CONTAINER_TYPES = Set.of("application/x-tika-msoffice", "application/x-cfb");

    private final UploadValidationProperties properties;
    private final Tika tika = new Tika();

    /**
     * Validates the staged file.
     *
     * @param stagedFile   path of the uploaded bytes
     * @param originalName file name declared by the client
     * @param actorId      uploader for the audit log, may be null
     * @return the resolved MIME type
     * @throws UploadValidationException if the extension or the detected type is not allowed
     */
    public String validateUploadedFile(Path stagedFile, String originalName, String actorId) {
        String ext = extensionOf(originalName);
        if (!properties.getAllowedExtensions().contains(ext)) {
            throw reject(stagedFile, "File extension \"." + ext + "\" is not allowed");
        }

        String detected;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(stagedFile))) {
            detected = tika.detect(in);
        } catch (IOException e) {
            throw reject(stagedFile, "Unable to read uploaded file: " + e.getMessage());
        }

        String mime = refine(detected, ext);
        if (mime == null) {
            throw reject(stagedFile, "Unable to determine file type");
        }
        if (!properties.getAllowedMimeTypes().contains(mime)) {
            log.warn("Upload rejected: unsupported mime (actor={}, filename={}, mime={})",
                    actorOrAnon(actorId), originalName, mime);
            throw reject(stagedFile, "Detected MIME \"" + mime + "\" is not allowed");
        }

        log.info("Upload accepted (actor={}, filename={}, mime={})", actorOrAnon(actorId), originalName, mime);
        return mime;
    }

    private String refine(String detected, String ext) {
        if ("md".equals(ext) && (detected == null || MIME_OCTET_STREAM.equals(detected) || MIME_TEXT_PLAIN.equals(detected))) {
            return MIME_MARKDOWN;
        }
        if ("docx".equals(ext) && ZIP_CONTAINER_TYPES.contains(detected)) {
            return MIME_DOCX;
        }
        if ("doc".equals(ext) && OLE2_CONTAINER_TYPES.contains(detected)) {
            return MIME_DOC;
        }
        return detected;
    }

    private UploadValidationException reject(Path stagedFile, String reason) {
        UploadValidationException rejection = new UploadValidationException(reason);
        try {
            Files.deleteIfExists(stagedFile);
        } catch (IOException e) {
            log.error("Failed to delete rejected upload {}", stagedFile, e);
            rejection.addSuppressed(e);
        }
        return rejection;
    }

    private static String extensionOf(String originalName) {
        if (originalName == null) {
            return "";
        }
        int dot = originalName.lastIndexOf('.');
        return dot >= 0 ? originalName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    private static String actorOrAnon(String actorId) {
        return actorId == null || actorId.isBlank() ? "anon" : actorId;
    }
}
