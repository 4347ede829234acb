package com.tradeingest.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.enums.ImportType;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One upload attempt and its progress.
 *
 * <p>Invariant: {@code totalRecords >= successCount + errorCount}; rows skipped as duplicates count
 * toward neither. The raw file content is kept only while the batch waits at PENDING for a broker
 * selection or mapping approval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportBatch {

    private String id;
    private String userId;
    private String filename;
    private long fileSize;
    private BrokerType brokerType;
    private ImportType importType;
    private ImportBatchStatus status;
    private int totalRecords;
    private int successCount;
    private int errorCount;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private boolean aiMappingUsed;
    private Double mappingConfidence;

    @Builder.Default
    private List<ColumnMapping> columnMappings = new ArrayList<>();

    private boolean userReviewRequired;
    private boolean requiresBrokerSelection;
    private String brokerFormatId;
    private String brokerNameHint;
    private String accountTags;

    @JsonIgnore
    private String rawContent;

    private LocalDateTime createdAt;
    private LocalDateTime processingStartedAt;
    private LocalDateTime processingCompletedAt;
}
