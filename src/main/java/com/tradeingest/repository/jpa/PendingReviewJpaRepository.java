package com.tradeingest.repository.jpa;

import com.tradeingest.domain.enums.ReviewStatus;
import com.tradeingest.entity.PendingReviewEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PendingReviewJpaRepository extends JpaRepository<PendingReviewEntity, String> {

    Optional<PendingReviewEntity> findFirstByImportBatchIdAndStatus(String importBatchId, ReviewStatus status);
}
