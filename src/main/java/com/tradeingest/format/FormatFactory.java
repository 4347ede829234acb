package com.tradeingest.format;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.DetectionPatterns;
import com.tradeingest.domain.model.FieldMapping;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/** Builds learned formats from approved mappings and computes registry fingerprints. */
public final class FormatFactory {

    static final int MAX_EXAMPLES = 3;

    private FormatFactory() {}

    /** Sorted, lower-cased, trimmed column names joined by "|". */
    public static String fingerprint(Collection<String> columns) {
        return columns.stream()
                .filter(Objects::nonNull)
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .filter(c -> !c.isEmpty())
                .distinct()
                .sorted()
                .collect(Collectors.joining("|"));
    }

    /**
     * Creates a format from a confirmed mapping. Only mappings with a target field are kept; their
     * columns become the fingerprint, and those landing on a required canonical field become the
     * required headers the detector checks.
     */
    public static BrokerFormat fromMapping(
            String name,
            String brokerName,
            List<ColumnMapping> mappings,
            List<Map<String, String>> sampleRows,
            double confidence,
            String createdBy) {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        List<String> requiredHeaders = new ArrayList<>();

        for (ColumnMapping mapping : mappings) {
            String target = mapping.getTargetColumn();
            if (mapping.getSourceColumn() == null || target == null || target.isBlank()) {
                continue;
            }
            boolean required = CanonicalField.fromFieldName(target)
                    .map(CanonicalField::isRequired)
                    .orElse(false);
            FieldDataType dataType = mapping.getDataType() != null
                    ? mapping.getDataType()
                    : CanonicalField.fromFieldName(target)
                            .map(CanonicalField::getDataType)
                            .orElse(FieldDataType.STRING);
            fields.put(mapping.getSourceColumn(), FieldMapping.builder()
                    .targetField(target)
                    .dataType(dataType)
                    .required(required)
                    .transformer(mapping.getTransformer())
                    .examples(examples(mapping.getSourceColumn(), sampleRows))
                    .build());
            if (required) {
                requiredHeaders.add(mapping.getSourceColumn());
            }
        }

        LocalDateTime now = LocalDateTime.now();
        return BrokerFormat.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .description("Learned from an approved mapping")
                .brokerName(brokerName)
                .brokerType(BrokerType.fromBrokerName(brokerName))
                .fingerprint(fingerprint(fields.keySet()))
                .confidence(confidence)
                .fieldMappings(fields)
                .detectionPatterns(DetectionPatterns.builder().requiredHeaders(requiredHeaders).build())
                .createdBy(createdBy)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** "&lt;Broker&gt; Format N", numbered after the formats already registered for that broker. */
    public static String nextFormatName(String brokerName, List<BrokerFormat> existing) {
        String broker = brokerName == null || brokerName.isBlank() ? "Custom" : brokerName.trim();
        long count = existing.stream()
                .filter(f -> !f.isSeeded())
                .filter(f -> f.getBrokerName() != null && f.getBrokerName().equalsIgnoreCase(broker))
                .count();
        return broker + " Format " + (count + 1);
    }

    /** Running success rate after one more use. */
    static double nextSuccessRate(double rate, int usageCount, boolean success) {
        long successes = Math.round(rate * usageCount);
        return (double) (successes + (success ? 1 : 0)) / (usageCount + 1);
    }

    private static List<String> examples(String column, List<Map<String, String>> sampleRows) {
        if (sampleRows == null) {
            return new ArrayList<>();
        }
        return sampleRows.stream()
                .map(row -> row.get(column))
                .filter(v -> v != null && !v.isBlank())
                .limit(MAX_EXAMPLES)
                .collect(Collectors.toList());
    }
}
