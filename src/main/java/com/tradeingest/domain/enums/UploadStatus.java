package com.tradeingest.domain.enums;

/** Audit-level progress of one upload: UPLOADED, PARSING, MAPPED, IMPORTED, or FAILED at any point. */
public enum UploadStatus {
    UPLOADED,
    PARSING,
    MAPPED,
    IMPORTED,
    FAILED
}
