package com.tradeingest.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.DetectionPatterns;
import com.tradeingest.mapper.JsonHelper;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for the JSON column helper. */
class JsonHelperTest {

    @Test
    @DisplayName("Lists read from a column can be appended to")
    void listsAreMutable() {
        List<String> errors = JsonHelper.fromJsonList("[\"Row 1: Missing symbol\"]", String.class);
        errors.add("Row 2: Missing side");

        assertThat(errors).containsExactly("Row 1: Missing symbol", "Row 2: Missing side");

        List<String> empty = JsonHelper.fromJsonList(null, String.class);
        empty.add("Row 1: Missing symbol");
        assertThat(empty).hasSize(1);
    }

    @Test
    @DisplayName("Column mappings from a caller ignore properties this build does not know")
    void columnMappingsIgnoreUnknownProperties() {
        String json = "[{\"sourceColumn\":\"Qty\",\"targetColumn\":\"quantity\",\"dataType\":\"NUMBER\","
                + "\"confidence\":0.9,\"comment\":\"from a newer client\"}]";

        List<ColumnMapping> mappings = JsonHelper.fromJsonList(json, ColumnMapping.class);

        assertThat(mappings).singleElement().satisfies(m -> {
            assertThat(m.getSourceColumn()).isEqualTo("Qty");
            assertThat(m.getTargetColumn()).isEqualTo("quantity");
            assertThat(m.getDataType()).isEqualTo(FieldDataType.NUMBER);
        });
    }

    @Test
    @DisplayName("Blank columns read as null and malformed text fails loudly")
    void blankAndMalformed() {
        assertThat(JsonHelper.fromJson("  ", new TypeReference<DetectionPatterns>() {})).isNull();
        assertThat(JsonHelper.toJson(null)).isNull();

        assertThatThrownBy(() -> JsonHelper.fromJsonList("{not json", ColumnMapping.class))
                .isInstanceOf(IllegalStateException.class);
    }
}
