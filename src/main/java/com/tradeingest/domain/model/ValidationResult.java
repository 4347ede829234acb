package com.tradeingest.domain.model;

import com.tradeingest.parser.FileSizeTier;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Pre-upload preview: parse and detection output with nothing persisted. */
@Getter
@Builder
public class ValidationResult {

    private final List<String> headers;
    private final List<Map<String, String>> sampleRows;
    private final int rowCount;
    private final long fileSize;
    private final FileSizeTier sizeTier;
    private final boolean sectionedExport;
    private final boolean standardSchema;
    private final String detectedFormatId;
    private final String detectedFormatName;
    private final double confidence;
    private final List<String> reasoning;
}
