package uk.gegc.edgeprompt.features.ai.application;

import java.util.function.BooleanSupplier;

/**
 * Single-turn access to the chat completion endpoint.
 */
public interface CompletionClient {

    /**
     * Sends the prompt as the user message and returns the first choice's text.
     *
     * @throws uk.gegc.edgeprompt.shared.exception.AiServiceException on transport errors, non-2xx answers
     *                                                               or when the deadline passes
     */
    default String complete(String prompt) {
        return complete(prompt, () -> false);
    }

    /**
     * Same as {@link #complete(String)} but abandons the call once {@code cancellationChecker} returns true.
     *
     * @throws uk.gegc.edgeprompt.shared.exception.CompletionCancelledException if cancelled
     */
    String complete(String prompt, BooleanSupplier cancellationChecker);

    /**
     * True when {@code GET /v1/models} answers 200. Never throws.
     */
    boolean isAvailable();
}
