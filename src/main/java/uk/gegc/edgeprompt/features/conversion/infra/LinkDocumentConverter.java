package uk.gegc.edgeprompt.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.conversion.application.LinkFetchService;
import uk.gegc.edgeprompt.features.conversion.domain.ConversionResult;
import uk.gegc.edgeprompt.features.conversion.domain.DocumentConverter;

/**
 * {@code url} materials: the content is the address, the result is the raw response body.
 */
@Component
@RequiredArgsConstructor
public class LinkDocumentConverter implements DocumentConverter {

    private final LinkFetchService linkFetchService;

    @Override
    public boolean supports(String typeTag) {
        return "url".equals(typeTag);
    }

    @Override
    public ConversionResult convert(String url) {
        return new ConversionResult(linkFetchService.fetchBody(url));
    }
}
