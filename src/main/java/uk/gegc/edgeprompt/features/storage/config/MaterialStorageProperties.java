package uk.gegc.edgeprompt.features.storage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "edgeprompt.storage")
@Data
public class MaterialStorageProperties {

    /**
     * Root of the upload tree; holds {@code temp/} and {@code materials/}.
     */
    private String rootDir = "uploads";

    /**
     * Extensions (with leading dot) that may be moved into permanent storage.
     */
    private List<String> allowedTypes = new ArrayList<>(List.of(".pdf", ".docx", ".doc", ".txt", ".md"));

    /**
     * Largest accepted file, 10 MiB by default.
     */
    private long maxFileSize = 10L * 1024 * 1024;
}
