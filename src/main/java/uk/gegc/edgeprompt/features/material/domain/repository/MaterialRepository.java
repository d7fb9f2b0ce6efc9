package uk.gegc.edgeprompt.features.material.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.edgeprompt.features.material.domain.model.Material;
import uk.gegc.edgeprompt.features.material.domain.model.MaterialStatus;

import java.util.List;
import java.util.UUID;

public interface MaterialRepository extends JpaRepository<Material, UUID> {

    List<Material> findByProjectIdOrderByCreatedAtDesc(UUID projectId);

    /**
     * Sets the status without loading or overwriting the other columns.
     *
     * @return number of updated rows (0 when the material does not exist)
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Material m SET m.status = :status WHERE m.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") MaterialStatus status);
}
