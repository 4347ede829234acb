package com.tradeingest.ingest;

import com.tradeingest.domain.enums.ReviewStatus;
import com.tradeingest.domain.model.ImportBatch;
import com.tradeingest.domain.model.MappingProposal;
import com.tradeingest.entity.PendingReviewEntity;
import com.tradeingest.mapper.JsonHelper;
import com.tradeingest.repository.jpa.PendingReviewJpaRepository;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** AI mapping proposals awaiting a user decision, at most one open review per batch. */
@Service
public class PendingReviewService {

    private static final Logger log = LoggerFactory.getLogger(PendingReviewService.class);

    private final PendingReviewJpaRepository pendingReviewJpaRepository;

    public PendingReviewService(PendingReviewJpaRepository pendingReviewJpaRepository) {
        this.pendingReviewJpaRepository = pendingReviewJpaRepository;
    }

    /** Opens a review for the batch, or replaces the proposal on the one already open. */
    public PendingReviewEntity open(
            ImportBatch batch, String uploadLogId, String brokerName, MappingProposal proposal) {
        PendingReviewEntity entity = findOpen(batch.getId()).orElseGet(() -> PendingReviewEntity.builder()
                .id(UUID.randomUUID().toString())
                .userId(batch.getUserId())
                .importBatchId(batch.getId())
                .uploadLogId(uploadLogId)
                .status(ReviewStatus.PENDING)
                .createdAt(LocalDateTime.now())
                .build());
        entity.setBrokerName(brokerName);
        entity.setProposedMappings(JsonHelper.toJson(proposal.getMappings()));
        entity.setOverallConfidence(proposal.getOverallConfidence());
        entity.setUnmappedFields(JsonHelper.toJson(proposal.getUnmappedFields()));
        pendingReviewJpaRepository.save(entity);
        log.info("Pending review {} for batch {}, confidence={}", entity.getId(), batch.getId(),
                proposal.getOverallConfidence());
        return entity;
    }

    public Optional<PendingReviewEntity> findOpen(String importBatchId) {
        return pendingReviewJpaRepository.findFirstByImportBatchIdAndStatus(importBatchId, ReviewStatus.PENDING);
    }

    /** Closes the open review of a batch, if any. */
    public void resolve(String importBatchId, ReviewStatus outcome) {
        findOpen(importBatchId).ifPresent(review -> {
            review.setStatus(outcome);
            review.setResolvedAt(LocalDateTime.now());
            pendingReviewJpaRepository.save(review);
            log.info("Pending review {} resolved as {}", review.getId(), outcome);
        });
    }
}
