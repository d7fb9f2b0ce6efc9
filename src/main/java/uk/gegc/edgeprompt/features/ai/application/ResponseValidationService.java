package uk.gegc.edgeprompt.features.ai.application;

import uk.gegc.edgeprompt.features.ai.domain.ValidationResult;
import uk.gegc.edgeprompt.features.ai.domain.ValidationRule;

/**
 * Grades a student answer against a rule with the LLM.
 */
public interface ResponseValidationService {

    /**
     * Never throws: any failure yields {@code ValidationResult(false, 0, "Validation failed: ...")}.
     */
    ValidationResult validateResponse(String question, String answer, ValidationRule rule);
}
