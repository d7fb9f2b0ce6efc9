package uk.gegc.edgeprompt.shared.exception;

/**
 * Exception thrown when a requested resource does not exist
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
