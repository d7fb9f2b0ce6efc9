package uk.gegc.edgeprompt.shared.exception;

/**
 * Exception thrown when material file storage operations fail
 */
public class DocumentStorageException extends RuntimeException {

    public DocumentStorageException(String message) {
        super(message);
    }

    public DocumentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
