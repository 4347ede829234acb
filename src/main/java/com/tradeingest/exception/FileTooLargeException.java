package com.tradeingest.exception;

import java.util.Map;

/**
 * Upload exceeds what this service processes in-request. Carries a recommendation so the caller can
 * hand the file to its background worker instead.
 */
public class FileTooLargeException extends BaseException {

    public FileTooLargeException(long fileSize, long limit, String recommendation) {
        super(
                ErrorCode.PAYLOAD_TOO_LARGE,
                "File of " + fileSize + " bytes exceeds the " + limit + " byte processing limit",
                Map.of("fileSize", fileSize, "limit", limit, "recommendation", recommendation));
    }
}
