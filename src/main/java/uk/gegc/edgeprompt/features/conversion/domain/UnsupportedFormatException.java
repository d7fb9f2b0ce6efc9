package uk.gegc.edgeprompt.features.conversion.domain;

/**
 * Exception thrown when a material type is not handled by any converter.
 */
public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
