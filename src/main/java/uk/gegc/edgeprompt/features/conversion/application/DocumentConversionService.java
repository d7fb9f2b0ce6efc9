package uk.gegc.edgeprompt.features.conversion.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionResult;
import uk.gegc.edgeprompt.features.conversion.domain.DocumentConverter;
import uk.gegc.edgeprompt.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialSource;

import java.util.List;
import java.util.Locale;

/**
 * Turns a material source into plain text by delegating to the converter registered for its type tag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentConversionService {

    private final List<DocumentConverter> converters;

    /**
     * Extracts text from the source.
     *
     * @param source type tag plus inline text, stored file path or URL
     * @return the extracted text
     * @throws UnsupportedFormatException if no converter handles the type
     * @throws uk.gegc.edgeprompt.features.conversion.domain.ConversionFailedException if extraction fails
     */
    public String extractContent(MaterialSource source) {
        String type = normalizeType(source.type());
        try {
            DocumentConverter converter = findConverter(type);
            if (converter == null) {
                throw new UnsupportedFormatException("Unsupported material type: " + type);
            }

            log.debug("Extracting '{}' content with {}", type, converter.getClass().getSimpleName());
            ConversionResult result = converter.convert(source.content());
            return result.text();
        } catch (RuntimeException e) {
            log.error("Content extraction error (type={}): {}", type, e.getMessage());
            throw e;
        }
    }

    static String normalizeType(String type) {
        if (type == null) {
            return "";
        }
        String lower = type.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower.substring(1) : lower;
    }

    private DocumentConverter findConverter(String type) {
        return converters.stream()
                .filter(converter -> converter.supports(type))
                .findFirst()
                .orElse(null);
    }
}
