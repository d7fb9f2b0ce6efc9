package uk.gegc.edgeprompt.features.material.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.conversion.application.DocumentConversionService;
import uk.gegc.edgeprompt.features.material.domain.model.Material;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialMetadata;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialSource;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialStatus;
import uk.gegc.edgeprompt.features.material.domain.repository.MaterialRepository;
import uk.gegc.edgeprompt.features.storage.application.MaterialStorageService;
import uk.gegc.edgeprompt.shared.exception.DocumentStorageException;
import uk.gegc.edgeprompt.shared.exception.ResourceNotFoundException;
import uk.gegc.edgeprompt.shared.exception.UploadValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Drives a material through {@code pending -> processing -> completed | error}.
 * Every transition is saved on its own so other readers can follow progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialProcessingService {

    static final String DEFAULT_TITLE = "Untitled Material";

    private final MaterialRepository materialRepository;
    private final MaterialStorageService storageService;
    private final DocumentConversionService conversionService;
    private final MaterialStatusUpdater statusUpdater;

    /**
     * Creates a material from the source, stores the uploaded file if there is one and extracts its text.
     *
     * @param source    inline text, URL, or the absolute path of a staged upload
     * @param projectId owning project
     * @return the completed material as stored
     * @throws UploadValidationException if the staged file is too large or of a disallowed type
     */
    public Material processMaterial(MaterialSource source, UUID projectId) {
        Material material = materialRepository.save(newPendingMaterial(source, projectId));
        UUID materialId = material.getId();
        log.info("Processing material {} (project={}, type={})", materialId, projectId, source.type());

        try {
            material.setStatus(MaterialStatus.PROCESSING);
            material = materialRepository.save(material);

            String extractionTarget = source.content();
            if (source.isFileBased()) {
                Path staged = Path.of(source.content());
                if (!storageService.isStagedUpload(staged)) {
                    throw new UploadValidationException("File is not a staged upload");
                }
                long size = sizeOf(staged);
                String fileName = staged.getFileName().toString();

                if (!storageService.validateFileSize(size)) {
                    throw rejectStaged(staged, "File size exceeds limit");
                }
                if (!storageService.validateFileType(fileName)) {
                    throw rejectStaged(staged, "File type not supported");
                }

                Path stored = storageService.saveMaterialFile(staged, projectId, materialId);
                material.setFilePath(stored.toString());
                material.setFileType(extensionWithoutDot(fileName));
                material.setFileSize(size);
                material = materialRepository.save(material);
                extractionTarget = stored.toString();
            }

            String content = conversionService.extractContent(source.withContent(extractionTarget));

            material.setContent(content);
            material.setStatus(MaterialStatus.COMPLETED);
            materialRepository.save(material);
            log.info("Material {} completed ({} characters)", materialId, content.length());

            return materialRepository.findById(materialId)
                    .orElseThrow(() -> new ResourceNotFoundException("Material " + materialId + " not found"));
        } catch (RuntimeException | Error e) {
            log.error("Processing of material {} failed: {}", materialId, e.toString());
            statusUpdater.markFailedQuietly(materialId, e);
            throw e;
        }
    }

    /**
     * Extracts text without creating a material.
     */
    public String extractContent(MaterialSource source) {
        return conversionService.extractContent(source);
    }

    private Material newPendingMaterial(MaterialSource source, UUID projectId) {
        MaterialMetadata metadata = source.metadata().copy();
        String title = metadata.getTitle();

        Material material = new Material();
        material.setProjectId(projectId);
        material.setTitle(title == null || title.isBlank() ? DEFAULT_TITLE : title);
        material.setContent("");
        material.setFocusArea(metadata.getFocusArea() == null ? "" : metadata.getFocusArea());
        material.setMetadata(metadata);
        material.setStatus(MaterialStatus.PENDING);
        return material;
    }

    private long sizeOf(Path staged) {
        try {
            return Files.size(staged);
        } catch (IOException e) {
            throw new DocumentStorageException("Cannot read staged file " + staged, e);
        }
    }

    private UploadValidationException rejectStaged(Path staged, String reason) {
        if (!storageService.deleteFile(staged)) {
            log.warn("Rejected staged file {} could not be removed", staged);
        }
        return new UploadValidationException(reason);
    }

    private static String extensionWithoutDot(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
