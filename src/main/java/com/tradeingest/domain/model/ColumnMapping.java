package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.FieldDataType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One resolved column-to-field instruction, whether it came from a registry format, the AI adapter
 * or the user. Higher {@code priority} wins a target-field conflict; ties go to higher confidence.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMapping {

    private String sourceColumn;

    private String targetColumn;

    @Builder.Default
    private double confidence = 1.0;

    private int priority;

    @Builder.Default
    private FieldDataType dataType = FieldDataType.STRING;

    private String transformer;
}
