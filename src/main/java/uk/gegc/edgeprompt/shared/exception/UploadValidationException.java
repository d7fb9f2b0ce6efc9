package uk.gegc.edgeprompt.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an uploaded file is rejected by extension, detected MIME type or size.
 * The offending staged file has already been removed when this is raised.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UploadValidationException extends RuntimeException {

    public UploadValidationException(String message) {
        super(message);
    }

    public UploadValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
