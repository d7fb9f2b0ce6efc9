package uk.gegc.edgeprompt.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionResult;
import uk.gegc.edgeprompt.features.conversion.domain.DocumentConverter;

/**
 * Plain text passthrough. A stored file is read as UTF-8, inline text is returned as is.
 */
@Component
@Slf4j
public class TxtPassthroughConverter implements DocumentConverter {

    @Override
    public boolean supports(String typeTag) {
        return "txt".equals(typeTag) || "text".equals(typeTag);
    }

    @Override
    public ConversionResult convert(String content) {
        if (StoredFileReader.isAbsolutePath(content)) {
            String text = StoredFileReader.readUtf8(content);
            log.debug("Read text file {} ({} characters)", content, text.length());
            return new ConversionResult(text);
        }
        return new ConversionResult(content);
    }
}
