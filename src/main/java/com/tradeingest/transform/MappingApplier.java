package com.tradeingest.transform;

import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.model.ColumnMapping;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies resolved column mappings to one row with first-match-wins semantics.
 *
 * <p>Mappings run in order of priority (descending), then confidence (descending), then source column
 * name, so the outcome does not depend on the order columns appear in the file. Once a target field
 * is filled, later mappings to the same field are skipped and noted as a diagnostic. Mappings to
 * {@code brokerMetadata} accumulate into the side-channel map instead.
 *
 * <p>Coercion: NUMBER strips currency symbols and thousands separators; DATE parses US-style and ISO
 * shapes; BOOLEAN is true for any non-blank value; everything else stays a string. A value that fails
 * coercion is skipped for that field only.
 */
@Component
public class MappingApplier {

    private static final Logger log = LoggerFactory.getLogger(MappingApplier.class);

    static final Comparator<ColumnMapping> APPLICATION_ORDER = Comparator.comparingInt(ColumnMapping::getPriority)
            .reversed()
            .thenComparing(Comparator.comparingDouble(ColumnMapping::getConfidence).reversed())
            .thenComparing(m -> m.getSourceColumn().toLowerCase(Locale.ROOT));

    public MappedRow apply(Map<String, String> row, List<ColumnMapping> mappings) {
        MappedRow mapped = new MappedRow();
        for (ColumnMapping mapping : orderForApplication(mappings)) {
            String target = mapping.getTargetColumn();
            if (target == null || target.isBlank()) {
                continue;
            }
            Optional<String> cell = lookup(row, mapping.getSourceColumn());
            if (cell.isEmpty()) {
                continue;
            }
            String raw = cell.get();

            if (CanonicalField.BROKER_METADATA.getFieldName().equalsIgnoreCase(target)) {
                mapped.addMetadata(mapping.getSourceColumn(), raw);
                continue;
            }

            String field = CanonicalField.fromFieldName(target)
                    .map(CanonicalField::getFieldName)
                    .orElse(target);
            if (mapped.isFilled(field)) {
                String note = "Skipped " + mapping.getSourceColumn() + " -> " + field + ": already filled from "
                        + mapped.getSourceColumn(field).orElse("?");
                mapped.addDiagnostic(note);
                log.debug("Mapping conflict: {}", note);
                continue;
            }

            String transformed = transform(mapping, raw, mapped);
            if (transformed == null || transformed.isBlank()) {
                continue;
            }

            Object value = coerce(mapping.getDataType(), transformed);
            if (value == null) {
                String note = "Skipped " + mapping.getSourceColumn() + " -> " + field + ": '" + raw
                        + "' is not a valid " + mapping.getDataType().name().toLowerCase(Locale.ROOT);
                mapped.addDiagnostic(note);
                log.debug("Coercion skipped: {}", note);
                continue;
            }
            mapped.fill(field, value, mapping.getSourceColumn());
        }
        return mapped;
    }

    public static List<ColumnMapping> orderForApplication(List<ColumnMapping> mappings) {
        List<ColumnMapping> ordered = new ArrayList<>(mappings);
        ordered.removeIf(m -> m.getSourceColumn() == null);
        ordered.sort(APPLICATION_ORDER);
        return ordered;
    }

    /** Coerces transformed text to the declared type; null when the text is not a valid value. */
    static Object coerce(FieldDataType dataType, String text) {
        FieldDataType type = dataType != null ? dataType : FieldDataType.STRING;
        switch (type) {
            case NUMBER:
                try {
                    return new BigDecimal(FieldTransformer.stripCurrency(text));
                } catch (NumberFormatException e) {
                    return null;
                }
            case DATE:
                return TemporalParser.parseDateTime(text).orElse(null);
            case BOOLEAN:
                return !text.isBlank();
            default:
                return text;
        }
    }

    private String transform(ColumnMapping mapping, String raw, MappedRow mapped) {
        String name = mapping.getTransformer();
        if (name == null || name.isBlank()) {
            return raw;
        }
        Optional<FieldTransformer> transformer = FieldTransformer.fromName(name);
        if (transformer.isEmpty()) {
            mapped.addDiagnostic("Unknown transformer " + name + " on " + mapping.getSourceColumn());
            return raw;
        }
        return transformer.get().apply(raw);
    }

    private static Optional<String> lookup(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null) {
            for (Map.Entry<String, String> entry : row.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(column.trim())) {
                    value = entry.getValue();
                    break;
                }
            }
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
