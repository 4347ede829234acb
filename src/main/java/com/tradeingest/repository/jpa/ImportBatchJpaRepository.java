package com.tradeingest.repository.jpa;

import com.tradeingest.entity.ImportBatchEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the import_batches table. Reads are always scoped to the owning user.
 */
@Repository
public interface ImportBatchJpaRepository extends JpaRepository<ImportBatchEntity, String> {

    Optional<ImportBatchEntity> findByIdAndUserId(String id, String userId);

    List<ImportBatchEntity> findByUserIdOrderByCreatedAtDesc(String userId);
}
