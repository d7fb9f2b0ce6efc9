package uk.gegc.edgeprompt.features.conversion.domain;

/**
 * The remote body is larger than {@code link.fetch.max-content-size-bytes}.
 */
public class ContentSizeLimitException extends LinkFetchException {

    public ContentSizeLimitException(String message) {
        super(message);
    }
}
