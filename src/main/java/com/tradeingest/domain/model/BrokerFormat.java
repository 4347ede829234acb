package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.BrokerType;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, versioned column-mapping template for one broker export layout.
 *
 * <p>Seeded formats ship with the service; dynamic formats are created from a user-confirmed or
 * AI-approved mapping and stored in the {@code broker_formats} table. Both kinds carry usage
 * statistics that are updated every time the format is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerFormat {

    private String id;
    private String name;
    private String description;
    private String brokerName;

    @Builder.Default
    private BrokerType brokerType = BrokerType.GENERIC_CSV;

    @Builder.Default
    private String version = "1.0";

    /** Sorted, lower-cased column signature joined by "|". */
    private String fingerprint;

    /** Prior trust in this format, 0..1. */
    private double confidence;

    /** Column name to field mapping, in declaration order. */
    @Builder.Default
    private Map<String, FieldMapping> fieldMappings = new LinkedHashMap<>();

    @Builder.Default
    private DetectionPatterns detectionPatterns = new DetectionPatterns();

    private int usageCount;

    @Builder.Default
    private double successRate = 1.0;

    private boolean seeded;

    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isSectionedExport() {
        return detectionPatterns != null && detectionPatterns.getFileSignature() != null;
    }

    /**
     * Expands the field mappings into column mappings carrying this format's prior as confidence.
     * Required columns get priority 1 so they win a target-field conflict against optional ones.
     */
    public List<ColumnMapping> toColumnMappings() {
        List<ColumnMapping> mappings = new ArrayList<>();
        fieldMappings.forEach((column, mapping) -> mappings.add(ColumnMapping.builder()
                .sourceColumn(column)
                .targetColumn(mapping.getTargetField())
                .dataType(mapping.getDataType())
                .transformer(mapping.getTransformer())
                .priority(mapping.isRequired() ? 1 : 0)
                .confidence(confidence)
                .build()));
        return mappings;
    }
}
