package uk.gegc.edgeprompt.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when generation is requested for a material whose text has not been extracted successfully.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class MaterialNotProcessedException extends RuntimeException {

    private final UUID materialId;

    public MaterialNotProcessedException(UUID materialId, String status) {
        super("Material " + materialId + " is " + status + "; only completed materials can be used for generation.");
        this.materialId = materialId;
    }

    public UUID getMaterialId() {
        return materialId;
    }
}
