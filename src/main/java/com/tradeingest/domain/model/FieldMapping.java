package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.FieldDataType;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** How one source column of a registry format lands on a canonical field. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldMapping {

    private String targetField;

    @Builder.Default
    private FieldDataType dataType = FieldDataType.STRING;

    private boolean required;

    /** Name of a {@code FieldTransformer}; resolved when the mapping is applied. Null for none. */
    private String transformer;

    @Builder.Default
    private List<String> examples = new ArrayList<>();
}
