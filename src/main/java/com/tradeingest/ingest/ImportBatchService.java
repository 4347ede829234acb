package com.tradeingest.ingest;

import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.model.ImportBatch;
import com.tradeingest.event.EventPublisherHelper;
import com.tradeingest.exception.InvalidBatchStateException;
import com.tradeingest.exception.ResourceNotFoundException;
import com.tradeingest.mapper.ImportBatchMapper;
import com.tradeingest.repository.jpa.ImportBatchJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the import batch lifecycle: PENDING, then PROCESSING, then COMPLETED or FAILED.
 *
 * <p>Every status change goes through {@link ImportBatchStatus#canTransitionTo} and is persisted before
 * the matching event is published. The raw upload is dropped once a batch leaves PENDING for good.
 */
@Service
public class ImportBatchService {

    private static final Logger log = LoggerFactory.getLogger(ImportBatchService.class);

    private final ImportBatchJpaRepository importBatchJpaRepository;
    private final ImportBatchMapper importBatchMapper;
    private final EventPublisherHelper eventPublisherHelper;

    public ImportBatchService(
            ImportBatchJpaRepository importBatchJpaRepository,
            ImportBatchMapper importBatchMapper,
            EventPublisherHelper eventPublisherHelper) {
        this.importBatchJpaRepository = importBatchJpaRepository;
        this.importBatchMapper = importBatchMapper;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Persists a new batch in PENDING. */
    public ImportBatch create(ImportBatch batch) {
        batch.setId(UUID.randomUUID().toString());
        batch.setStatus(ImportBatchStatus.PENDING);
        batch.setCreatedAt(LocalDateTime.now());
        save(batch);
        log.info(
                "Import batch created: id={}, userId={}, file={}, records={}",
                batch.getId(),
                batch.getUserId(),
                batch.getFilename(),
                batch.getTotalRecords());
        eventPublisherHelper.publishBatchCreated(this, batch);
        return batch;
    }

    public ImportBatch startProcessing(ImportBatch batch) {
        ImportBatchStatus previous = transition(batch, ImportBatchStatus.PROCESSING, "start processing");
        batch.setProcessingStartedAt(LocalDateTime.now());
        save(batch);
        eventPublisherHelper.publishBatchProcessing(this, batch, previous);
        return batch;
    }

    /**
     * Closes a PROCESSING batch with the row counts of its import. The batch fails only when every
     * record failed; duplicates count toward neither outcome.
     */
    public ImportBatch finish(ImportBatch batch, ImportTally tally) {
        ImportBatchStatus target = tally.allFailed() ? ImportBatchStatus.FAILED : ImportBatchStatus.COMPLETED;
        ImportBatchStatus previous = transition(batch, target, "finish");
        batch.setTotalRecords(tally.getTotalRecords());
        batch.setSuccessCount(tally.getSuccessCount());
        batch.setErrorCount(tally.getErrorCount());
        batch.getErrors().addAll(tally.getErrors());
        batch.setProcessingCompletedAt(LocalDateTime.now());
        save(batch);

        Map<String, Object> details = Map.of("duplicates", tally.getDuplicateCount());
        if (target == ImportBatchStatus.COMPLETED) {
            log.info(
                    "Import batch completed: id={}, success={}, errors={}, duplicates={}",
                    batch.getId(),
                    batch.getSuccessCount(),
                    batch.getErrorCount(),
                    tally.getDuplicateCount());
            eventPublisherHelper.publishBatchCompleted(this, batch, previous, details);
        } else {
            log.warn("Import batch failed: id={}, all {} records rejected", batch.getId(), batch.getTotalRecords());
            eventPublisherHelper.publishBatchFailed(this, batch, previous, details);
        }
        return batch;
    }

    /** Fails a PENDING or PROCESSING batch outright with a single reason. */
    public ImportBatch fail(ImportBatch batch, String reason) {
        ImportBatchStatus previous = transition(batch, ImportBatchStatus.FAILED, "fail");
        batch.getErrors().add(reason);
        if (batch.getProcessingStartedAt() != null) {
            batch.setProcessingCompletedAt(LocalDateTime.now());
        }
        save(batch);
        log.warn("Import batch failed: id={}, reason={}", batch.getId(), reason);
        eventPublisherHelper.publishBatchFailed(this, batch, previous, Map.of("reason", reason));
        return batch;
    }

    /** Keeps a PENDING batch waiting for the user and announces why. */
    public ImportBatch park(ImportBatch batch) {
        if (batch.getStatus() != ImportBatchStatus.PENDING) {
            throw new InvalidBatchStateException(batch.getId(), batch.getStatus(), "wait for review");
        }
        save(batch);
        if (batch.isRequiresBrokerSelection()) {
            log.info("Import batch {} waiting for broker selection", batch.getId());
            eventPublisherHelper.publishBrokerSelectionRequired(this, batch);
        } else if (batch.isUserReviewRequired()) {
            log.info(
                    "Import batch {} waiting for mapping review, confidence={}",
                    batch.getId(),
                    batch.getMappingConfidence());
            eventPublisherHelper.publishReviewRequired(this, batch);
        }
        return batch;
    }

    /** Records a mapping-service failure on a PENDING batch. The upload stays available for a retry. */
    public ImportBatch recordAiFailure(ImportBatch batch, String message) {
        if (batch.getStatus().isTerminal()) {
            throw new InvalidBatchStateException(batch.getId(), batch.getStatus(), "record mapping failure");
        }
        batch.getErrors().add(message);
        save(batch);
        eventPublisherHelper.publishAiMappingFailed(this, batch, message);
        return batch;
    }

    /** Loads a batch owned by the user; a batch owned by someone else is reported as missing. */
    public ImportBatch get(String batchId, String userId) {
        return importBatchJpaRepository
                .findByIdAndUserId(batchId, userId)
                .map(importBatchMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("ImportBatch", batchId));
    }

    public List<ImportBatch> list(String userId) {
        return importBatchMapper.toDomainList(importBatchJpaRepository.findByUserIdOrderByCreatedAtDesc(userId));
    }

    public void save(ImportBatch batch) {
        importBatchJpaRepository.save(importBatchMapper.toEntity(batch));
    }

    private ImportBatchStatus transition(ImportBatch batch, ImportBatchStatus target, String attempted) {
        ImportBatchStatus current = batch.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            throw new InvalidBatchStateException(batch.getId(), current, attempted);
        }
        batch.setStatus(target);
        if (target.isTerminal()) {
            batch.setRawContent(null);
        }
        return current;
    }
}
