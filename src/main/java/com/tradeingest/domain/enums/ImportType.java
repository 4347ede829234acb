package com.tradeingest.domain.enums;

/** STANDARD for the canonical column layout, CUSTOM for everything that needed a mapping. */
public enum ImportType {
    STANDARD,
    CUSTOM
}
