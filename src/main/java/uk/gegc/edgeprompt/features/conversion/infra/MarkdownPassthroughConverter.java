package uk.gegc.edgeprompt.features.conversion.infra;

import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionResult;
import uk.gegc.edgeprompt.features.conversion.domain.DocumentConverter;

/**
 * Markdown is kept verbatim, markup included. Uploaded files are read so the
 * source, not the storage path, reaches the prompts.
 */
@Component
public class MarkdownPassthroughConverter implements DocumentConverter {

    @Override
    public boolean supports(String typeTag) {
        return "md".equals(typeTag) || "markdown".equals(typeTag);
    }

    @Override
    public ConversionResult convert(String content) {
        if (StoredFileReader.isAbsolutePath(content)) {
            return new ConversionResult(StoredFileReader.readUtf8(content));
        }
        return new ConversionResult(content);
    }
}
