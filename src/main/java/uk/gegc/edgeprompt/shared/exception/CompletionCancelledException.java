package uk.gegc.edgeprompt.shared.exception;

/**
 * Thrown when a caller cancels an in-flight completion request.
 */
public class CompletionCancelledException extends AiServiceException {

    public CompletionCancelledException(String message) {
        super(message);
    }
}
