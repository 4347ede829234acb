package com.tradeingest.domain.enums;

public enum ParseMethod {
    STANDARD,
    AI_MAPPED,
    USER_CORRECTED
}
