package com.tradeingest.entity;

import com.tradeingest.domain.enums.ParseMethod;
import com.tradeingest.domain.enums.UploadStatus;
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
 * JPA entity for the csv_upload_logs table.
 * Audit trail of one upload: UPLOADED -> PARSING -> MAPPED -> IMPORTED, or FAILED.
 */
@Entity
@Table(name = "csv_upload_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CsvUploadLogEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(length = 255)
    private String filename;

    @Column(name = "file_size")
    private long fileSize;

    /** JSON array of the header row as uploaded. */
    @Column(name = "original_headers", columnDefinition = "TEXT")
    private String originalHeaders;

    @Column(name = "row_count")
    private int rowCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "upload_status", columnDefinition = "varchar(20)")
    private UploadStatus uploadStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "parse_method", columnDefinition = "varchar(20)")
    private ParseMethod parseMethod;

    @Column(name = "import_batch_id", length = 36)
    private String importBatchId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
