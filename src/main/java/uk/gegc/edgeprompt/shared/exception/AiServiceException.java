package uk.gegc.edgeprompt.shared.exception;

/**
 * Exception thrown when the completion endpoint fails or cannot be reached
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
