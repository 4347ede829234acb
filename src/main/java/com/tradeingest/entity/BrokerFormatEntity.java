package com.tradeingest.entity;

import com.tradeingest.domain.enums.BrokerType;
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
 * JPA entity for the broker_formats table.
 * Holds formats learned from approved mappings; seeded formats live in code and are never stored.
 */
@Entity
@Table(name = "broker_formats")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BrokerFormatEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "broker_name", length = 100)
    private String brokerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "broker_type", columnDefinition = "varchar(30)")
    private BrokerType brokerType;

    @Column(length = 20)
    private String version;

    @Column(length = 2000, unique = true)
    private String fingerprint;

    private double confidence;

    /** JSON-serialized column name to FieldMapping map. */
    @Column(name = "field_mappings", columnDefinition = "TEXT")
    private String fieldMappings;

    /** JSON-serialized DetectionPatterns. */
    @Column(name = "detection_patterns", columnDefinition = "TEXT")
    private String detectionPatterns;

    @Column(name = "usage_count")
    private int usageCount;

    @Column(name = "success_rate")
    private double successRate;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
