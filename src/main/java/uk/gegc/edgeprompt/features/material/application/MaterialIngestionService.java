package uk.gegc.edgeprompt.features.material.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.material.domain.model.Material;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialMetadata;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialSource;
import uk.gegc.edgeprompt.features.storage.application.MaterialStorageService;
import uk.gegc.edgeprompt.features.upload.application.UploadValidationService;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Entry point for an uploaded file: stage it, check its bytes, then process it as a material.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialIngestionService {

    private final MaterialStorageService storageService;
    private final UploadValidationService uploadValidationService;
    private final MaterialProcessingService materialProcessingService;

    public Material ingestUpload(InputStream upload,
                                 String originalName,
                                 String actorId,
                                 MaterialMetadata metadata,
                                 UUID projectId) {
        Path staged = storageService.stageUpload(upload, originalName);
        String mime = uploadValidationService.validateUploadedFile(staged, originalName, actorId);
        log.debug("Staged upload {} as {} ({})", originalName, staged.getFileName(), mime);

        return materialProcessingService.processMaterial(MaterialSource.ofFile(staged, metadata), projectId);
    }
}
