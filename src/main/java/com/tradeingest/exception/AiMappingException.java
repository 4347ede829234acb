package com.tradeingest.exception;

/**
 * The AI mapping service failed, timed out, or answered with something unusable.
 * The ingestion core converts this into a retryable PENDING batch instead of failing the upload.
 */
public class AiMappingException extends BaseException {

    public AiMappingException(String message) {
        super(ErrorCode.AI_MAPPING_UNAVAILABLE, message);
    }

    public AiMappingException(String message, Throwable cause) {
        super(ErrorCode.AI_MAPPING_UNAVAILABLE, message, cause);
    }
}
