package com.tradeingest.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    PAYLOAD_TOO_LARGE("PAYLOAD_TOO_LARGE", 413),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    AI_MAPPING_UNAVAILABLE("AI_MAPPING_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
