package com.tradeingest.domain.enums;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
