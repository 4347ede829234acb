package com.tradeingest.entity;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.enums.ImportType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the import_batches table.
 * One row per upload attempt; raw_content is kept only while the batch waits at PENDING.
 */
@Entity
@Table(name = "import_batches")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportBatchEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(length = 255)
    private String filename;

    @Column(name = "file_size")
    private long fileSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "broker_type", columnDefinition = "varchar(30)")
    private BrokerType brokerType;

    @Enumerated(EnumType.STRING)
    @Column(name = "import_type", columnDefinition = "varchar(20)")
    private ImportType importType;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private ImportBatchStatus status;

    @Column(name = "total_records")
    private int totalRecords;

    @Column(name = "success_count")
    private int successCount;

    @Column(name = "error_count")
    private int errorCount;

    /** JSON array of "Row N: reason" strings. */
    @Column(columnDefinition = "TEXT")
    private String errors;

    @Column(name = "ai_mapping_used")
    private boolean aiMappingUsed;

    @Column(name = "mapping_confidence")
    private Double mappingConfidence;

    /** JSON snapshot of the column mappings applied (or proposed, while PENDING). */
    @Column(name = "column_mappings", columnDefinition = "TEXT")
    private String columnMappings;

    @Column(name = "user_review_required")
    private boolean userReviewRequired;

    @Column(name = "requires_broker_selection")
    private boolean requiresBrokerSelection;

    @Column(name = "broker_format_id", length = 100)
    private String brokerFormatId;

    @Column(name = "broker_name_hint", length = 100)
    private String brokerNameHint;

    @Column(name = "account_tags", columnDefinition = "TEXT")
    private String accountTags;

    @Column(name = "raw_content", columnDefinition = "TEXT")
    private String rawContent;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "processing_started_at")
    private LocalDateTime processingStartedAt;

    @Column(name = "processing_completed_at")
    private LocalDateTime processingCompletedAt;
}
