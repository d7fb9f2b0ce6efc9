package uk.gegc.edgeprompt.features.conversion.domain;

/**
 * Raised when a {@code url} material cannot be downloaded.
 */
public class LinkFetchException extends RuntimeException {

    public LinkFetchException(String message) {
        super(message);
    }

    public LinkFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
