package uk.gegc.edgeprompt.features.conversion.domain;

/**
 * The URL (or a redirect target) points somewhere materials may not be fetched from.
 */
public class SsrfProtectionException extends LinkFetchException {

    public SsrfProtectionException(String message) {
        super(message);
    }

    public SsrfProtectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
