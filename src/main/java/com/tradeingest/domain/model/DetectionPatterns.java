package com.tradeingest.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signals the detector scores a format against.
 *
 * <p>Value patterns are regular expressions keyed by column name; inline flags such as {@code (?i)}
 * carry case-insensitivity so the patterns survive a round trip through the formats table.
 * A non-null {@code fileSignature} marks a multi-section export, which is scored on the whole file
 * content instead of headers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionPatterns {

    @Builder.Default
    private List<String> requiredHeaders = new ArrayList<>();

    @Builder.Default
    private Map<String, String> valuePatterns = new LinkedHashMap<>();

    private String fileSignature;

    @Builder.Default
    private List<String> sectionMarkers = new ArrayList<>();
}
