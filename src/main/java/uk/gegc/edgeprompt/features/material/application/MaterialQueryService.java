package uk.gegc.edgeprompt.features.material.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.edgeprompt.features.material.domain.model.Material;
import uk.gegc.edgeprompt.features.material.domain.repository.MaterialRepository;
import uk.gegc.edgeprompt.features.storage.application.MaterialStorageService;
import uk.gegc.edgeprompt.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialQueryService {

    private final MaterialRepository materialRepository;
    private final MaterialStorageService storageService;

    @Transactional(readOnly = true)
    public Material getMaterial(UUID materialId) {
        return materialRepository.findById(materialId)
                .orElseThrow(() -> new ResourceNotFoundException("Material " + materialId + " not found"));
    }

    /**
     * Materials of the project, newest first.
     */
    @Transactional(readOnly = true)
    public List<Material> getProjectMaterials(UUID projectId) {
        return materialRepository.findByProjectIdOrderByCreatedAtDesc(projectId);
    }

    /**
     * Removes the material's storage directory, then the row. The directory is removed even when
     * the row has no file path, since a failed run may have stored the file before it ended.
     */
    @Transactional
    public void deleteMaterial(UUID materialId) {
        Material material = getMaterial(materialId);
        storageService.deleteMaterialFiles(material.getProjectId(), materialId);
        materialRepository.delete(material);
        log.info("Deleted material {} (project={})", materialId, material.getProjectId());
    }
}
