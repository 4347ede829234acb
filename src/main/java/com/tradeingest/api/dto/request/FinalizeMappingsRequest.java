package com.tradeingest.api.dto.request;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The user's answer to an AI-proposed mapping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalizeMappingsRequest {

    /** Source column to canonical field name; "none" drops the column from the mapping. */
    @Builder.Default
    private Map<String, String> corrections = new LinkedHashMap<>();

    private boolean approved;

    /** Flags the proposal as wrong; the batch fails and nothing is imported. */
    private boolean reportError;
}
