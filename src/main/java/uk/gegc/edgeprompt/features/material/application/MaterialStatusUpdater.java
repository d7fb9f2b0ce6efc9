package uk.gegc.edgeprompt.features.material.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialStatus;
import uk.gegc.edgeprompt.features.material.domain.repository.MaterialRepository;

import java.util.UUID;

/**
 * Records a failed processing run without hiding the failure that caused it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaterialStatusUpdater {

    private final MaterialRepository materialRepository;

    /**
     * Moves the material to {@code error}. If that update fails too, the update failure is logged and
     * attached to {@code cause} as suppressed; nothing is thrown from here.
     */
    public void markFailedQuietly(UUID materialId, Throwable cause) {
        try {
            int updated = materialRepository.updateStatus(materialId, MaterialStatus.ERROR);
            if (updated == 0) {
                log.warn("Material {} vanished before it could be marked as failed", materialId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to mark material {} as failed", materialId, e);
            cause.addSuppressed(e);
        }
    }
}
