package uk.gegc.edgeprompt.features.upload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Allow-lists applied to uploaded files before they are processed.
 */
@Configuration
@ConfigurationProperties(prefix = "edgeprompt.upload")
@Data
public class UploadValidationProperties {

    /**
     * Extensions without the leading dot, lower case.
     */
    private Set<String> allowedExtensions = new LinkedHashSet<>(List.of("txt", "pdf", "doc", "docx", "md"));

    /**
     * MIME types accepted after content sniffing.
     */
    private Set<String> allowedMimeTypes = new LinkedHashSet<>(List.of(
            "text/plain",
            "text/markdown",
            "application/pdf",
            "application/msword",
            "application/x-cfb",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document"
    ));
}
