package com.tradeingest.ingest;

import com.tradeingest.domain.enums.ParseMethod;
import com.tradeingest.domain.enums.UploadStatus;
import com.tradeingest.entity.CsvUploadLogEntity;
import com.tradeingest.mapper.JsonHelper;
import com.tradeingest.repository.jpa.CsvUploadLogJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Audit trail of uploads: one row per parsed file, moved forward as the import progresses. */
@Service
public class UploadLogService {

    private static final Logger log = LoggerFactory.getLogger(UploadLogService.class);

    private final CsvUploadLogJpaRepository csvUploadLogJpaRepository;

    public UploadLogService(CsvUploadLogJpaRepository csvUploadLogJpaRepository) {
        this.csvUploadLogJpaRepository = csvUploadLogJpaRepository;
    }

    /** Records a file that parsed successfully. Returns the log id. */
    public String recordUpload(String userId, String filename, long fileSize, List<String> headers, int rowCount) {
        LocalDateTime now = LocalDateTime.now();
        CsvUploadLogEntity entity = CsvUploadLogEntity.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .filename(filename)
                .fileSize(fileSize)
                .originalHeaders(JsonHelper.toJson(headers))
                .rowCount(rowCount)
                .uploadStatus(UploadStatus.UPLOADED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        csvUploadLogJpaRepository.save(entity);
        log.debug("Upload logged: id={}, file={}, rows={}", entity.getId(), filename, rowCount);
        return entity.getId();
    }

    /** Moves the log forward. Null arguments leave the stored value unchanged. */
    public void update(
            String uploadLogId,
            UploadStatus status,
            ParseMethod parseMethod,
            String importBatchId,
            String errorMessage) {
        Optional<CsvUploadLogEntity> found =
                uploadLogId == null ? Optional.empty() : csvUploadLogJpaRepository.findById(uploadLogId);
        if (found.isEmpty()) {
            log.warn("Upload log {} not found, status {} not recorded", uploadLogId, status);
            return;
        }
        CsvUploadLogEntity entity = found.get();
        if (status != null) {
            entity.setUploadStatus(status);
        }
        if (parseMethod != null) {
            entity.setParseMethod(parseMethod);
        }
        if (importBatchId != null) {
            entity.setImportBatchId(importBatchId);
        }
        if (errorMessage != null) {
            entity.setErrorMessage(errorMessage);
        }
        entity.setUpdatedAt(LocalDateTime.now());
        csvUploadLogJpaRepository.save(entity);
    }

    public Optional<String> findIdByBatch(String importBatchId) {
        return csvUploadLogJpaRepository.findFirstByImportBatchId(importBatchId).map(CsvUploadLogEntity::getId);
    }
}
