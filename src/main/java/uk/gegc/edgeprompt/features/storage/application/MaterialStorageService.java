package uk.gegc.edgeprompt.features.storage.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.storage.config.MaterialStorageProperties;
import uk.gegc.edgeprompt.shared.exception.DocumentStorageException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Local file store for uploaded materials.
 * <pre>
 * {root}/temp/                                   staged uploads
 * {root}/materials/{projectId}/{materialId}/     material.&lt;ext&gt;
 * </pre>
 */
@Service
@Slf4j
public class MaterialStorageService {

    private static final String TEMP_DIR = "temp";
    private static final String MATERIALS_DIR = "materials";
    private static final String MATERIAL_FILE_BASENAME = "material";

    private final MaterialStorageProperties properties;
    private final Path rootDir;
    private final Path tempDir;
    private final Path materialsDir;

    public MaterialStorageService(MaterialStorageProperties properties) {
        this.properties = properties;
        this.rootDir = Paths.get(properties.getRootDir()).toAbsolutePath().normalize();
        this.tempDir = rootDir.resolve(TEMP_DIR);
        this.materialsDir = rootDir.resolve(MATERIALS_DIR);
    }

    public Path getTempDir() {
        return tempDir;
    }

    /**
     * Creates {@code temp/} and {@code materials/} if they are missing.
     */
    public void initialize() {
        try {
            Files.createDirectories(tempDir);
            Files.createDirectories(materialsDir);
            log.info("Material storage ready at {}", rootDir);
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to initialize storage at " + rootDir, e);
        }
    }

    public Path createMaterialStorage(UUID projectId, UUID materialId) {
        Path materialDir = materialDirectory(projectId, materialId);
        try {
            Files.createDirectories(materialDir);
            return materialDir;
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to create storage for material " + materialId, e);
        }
    }

    /**
     * Copies a staged file to {@code material<ext>} inside the material's directory and removes the staged copy.
     * An existing file for the same material is replaced.
     *
     * @return absolute path of the stored file
     */
    public Path saveMaterialFile(Path tempPath, UUID projectId, UUID materialId) {
        String ext = extensionOf(tempPath.getFileName().toString());
        if (!properties.getAllowedTypes().contains(ext)) {
            throw new DocumentStorageException("File type " + ext + " not allowed");
        }

        Path materialDir = createMaterialStorage(projectId, materialId);
        Path destination = materialDir.resolve(MATERIAL_FILE_BASENAME + ext);
        try {
            if (Files.exists(destination)) {
                log.warn("Replacing stored file for material {} at {}", materialId, destination);
            }
            Files.copy(tempPath, destination, StandardCopyOption.REPLACE_EXISTING);
            Files.delete(tempPath);
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to store file for material " + materialId, e);
        }

        log.debug("Stored material {} file at {}", materialId, destination);
        return destination;
    }

    /**
     * Writes an inbound upload into {@code temp/} under a unique name that keeps the declared extension.
     */
    public Path stageUpload(InputStream content, String originalName) {
        String ext = extensionOf(originalName == null ? "" : originalName);
        Path staged = tempDir.resolve(UUID.randomUUID() + ext);
        try {
            Files.createDirectories(tempDir);
            Files.copy(content, staged);
            return staged;
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to stage upload " + originalName, e);
        }
    }

    /**
     * True when the path lies inside {@code temp/}, i.e. it was produced by {@link #stageUpload}.
     */
    public boolean isStagedUpload(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return normalized.startsWith(tempDir) && !normalized.equals(tempDir);
    }

    public boolean validateFileSize(long bytes) {
        return bytes <= properties.getMaxFileSize();
    }

    public boolean validateFileType(String filename) {
        return properties.getAllowedTypes().contains(extensionOf(filename));
    }

    /**
     * Empties {@code temp/}. Failures are logged and otherwise ignored.
     */
    public void cleanupTemp() {
        try {
            deleteRecursively(tempDir);
            Files.createDirectories(tempDir);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to cleanup temp directory {}", tempDir, e);
        }
    }

    /**
     * Removes the material's directory. Failures are logged and otherwise ignored.
     */
    public void deleteMaterialFiles(UUID projectId, UUID materialId) {
        Path materialDir = materialDirectory(projectId, materialId);
        try {
            deleteRecursively(materialDir);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to delete files of material {} at {}", materialId, materialDir, e);
        }
    }

    /**
     * Deletes a single file, then its parent directory when that is left empty.
     *
     * @return true if the file existed and was removed
     */
    public boolean deleteFile(Path path) {
        if (path == null) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(path);
            Path parent = path.getParent();
            if (deleted && parent != null && parent.startsWith(materialsDir) && !parent.equals(materialsDir)) {
                try (Stream<Path> remaining = Files.list(parent)) {
                    if (remaining.findAny().isEmpty()) {
                        Files.delete(parent);
                    }
                }
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to delete file {}", path, e);
            return false;
        }
    }

    private Path materialDirectory(UUID projectId, UUID materialId) {
        return materialsDir.resolve(projectId.toString()).resolve(materialId.toString());
    }

    private void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        int sep = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot < 0 || dot < sep) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
