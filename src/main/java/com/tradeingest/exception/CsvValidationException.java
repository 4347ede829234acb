package com.tradeingest.exception;

import java.util.List;
import java.util.Map;

/**
 * The upload itself is unusable: empty, oversized, or not parseable as delimited text.
 * Thrown before any batch exists; the specific defects are listed under {@code details.defects}.
 */
public class CsvValidationException extends BaseException {

    private final List<String> defects;

    public CsvValidationException(String message, List<String> defects) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("defects", defects));
        this.defects = List.copyOf(defects);
    }

    public CsvValidationException(String defect) {
        this(defect, List.of(defect));
    }

    public List<String> getDefects() {
        return defects;
    }
}
