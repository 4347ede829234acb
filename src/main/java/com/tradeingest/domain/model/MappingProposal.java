package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.enums.FieldDataType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Column-to-field mapping proposed by an AI mapping adapter. Never applied without review. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingProposal {

    @Builder.Default
    private Map<String, ProposedField> mappings = new LinkedHashMap<>();

    private double overallConfidence;

    @Builder.Default
    private List<String> unmappedFields = new ArrayList<>();

    /**
     * Column mappings in proposal order, typed by the canonical field's default data type. Fields outside
     * the catalogue keep the raw string type.
     */
    public List<ColumnMapping> toColumnMappings() {
        List<ColumnMapping> columnMappings = new ArrayList<>();
        mappings.forEach((column, proposed) -> {
            if (proposed == null || proposed.getField() == null) {
                return;
            }
            columnMappings.add(ColumnMapping.builder()
                    .sourceColumn(column)
                    .targetColumn(proposed.getField())
                    .confidence(proposed.getConfidence())
                    .dataType(CanonicalField.fromFieldName(proposed.getField())
                            .map(CanonicalField::getDataType)
                            .orElse(FieldDataType.STRING))
                    .build());
        });
        return columnMappings;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProposedField {
        private String field;
        private double confidence;
    }
}
