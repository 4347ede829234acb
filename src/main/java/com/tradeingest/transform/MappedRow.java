package com.tradeingest.transform;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One source row after column mappings were applied: coerced canonical values, the side-channel
 * broker metadata, which source column filled each field, and diagnostics about skipped mappings.
 */
public class MappedRow {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> sourceColumns = new LinkedHashMap<>();
    private final Map<String, String> brokerMetadata = new LinkedHashMap<>();
    private final List<String> diagnostics = new ArrayList<>();

    boolean isFilled(String field) {
        return values.containsKey(field);
    }

    void fill(String field, Object value, String sourceColumn) {
        values.put(field, value);
        sourceColumns.put(field, sourceColumn);
    }

    void addMetadata(String column, String value) {
        brokerMetadata.put(column, value);
    }

    void addDiagnostic(String diagnostic) {
        diagnostics.add(diagnostic);
    }

    public Object get(String field) {
        return values.get(field);
    }

    public Optional<String> getString(String field) {
        Object value = values.get(field);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Optional<BigDecimal> getNumber(String field) {
        Object value = values.get(field);
        return value instanceof BigDecimal ? Optional.of((BigDecimal) value) : Optional.empty();
    }

    public Optional<LocalDateTime> getDateTime(String field) {
        Object value = values.get(field);
        return value instanceof LocalDateTime ? Optional.of((LocalDateTime) value) : Optional.empty();
    }

    /** Source column that filled the field, if any. */
    public Optional<String> getSourceColumn(String field) {
        return Optional.ofNullable(sourceColumns.get(field));
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, String> getBrokerMetadata() {
        return Collections.unmodifiableMap(brokerMetadata);
    }

    public List<String> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
