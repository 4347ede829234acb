package com.tradeingest.entity;

import com.tradeingest.domain.enums.ReviewStatus;
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
 * JPA entity for the pending_reviews table.
 * An AI-proposed mapping waiting for the user to approve, correct or reject it.
 */
@Entity
@Table(name = "pending_reviews")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingReviewEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "import_batch_id", length = 36)
    private String importBatchId;

    @Column(name = "upload_log_id", length = 36)
    private String uploadLogId;

    @Column(name = "broker_name", length = 100)
    private String brokerName;

    /** JSON list of proposed ColumnMappings. */
    @Column(name = "proposed_mappings", columnDefinition = "TEXT")
    private String proposedMappings;

    @Column(name = "overall_confidence")
    private double overallConfidence;

    /** JSON array of critical fields no column was mapped to. */
    @Column(name = "unmapped_fields", columnDefinition = "TEXT")
    private String unmappedFields;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private ReviewStatus status;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
