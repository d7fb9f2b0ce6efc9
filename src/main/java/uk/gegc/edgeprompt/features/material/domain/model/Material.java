package uk.gegc.edgeprompt.features.material.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A teacher's source document with its extracted text.
 * {@code content} stays empty until processing completes; the file columns are only set
 * for uploaded files.
 */
@Entity
@Table(name = "materials")
@Getter
@Setter
@NoArgsConstructor
public class Material {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "LONGTEXT")
    private String content = "";

    @Column(name = "focus_area", nullable = false, columnDefinition = "TEXT")
    private String focusArea = "";

    @Convert(converter = MaterialMetadataConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private MaterialMetadata metadata = new MaterialMetadata();

    @Column(name = "file_path", length = 1024)
    private String filePath;

    @Column(name = "file_type", length = 16)
    private String fileType;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "status", nullable = false, length = 20)
    private MaterialStatus status = MaterialStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
