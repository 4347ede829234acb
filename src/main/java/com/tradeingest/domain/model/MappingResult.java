package com.tradeingest.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** The mapping actually chosen for a batch, reported back to the caller. */
@Getter
@Builder
public class MappingResult {

    private final List<ColumnMapping> mappings;
    private final double overallConfidence;
    private final List<String> unmappedFields;
}
