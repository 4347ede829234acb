package com.tradeingest.mapping;

/** Processing path chosen for one upload, in the order the resolver tries them. */
public enum MappingStrategy {
    SECTIONED_EXPORT(false),
    STANDARD_SCHEMA(false),
    REGISTRY_HIGH(false),
    REGISTRY_MEDIUM(false),
    LEGACY_MATCH(false),
    AI_WITH_HINT(true),
    AI_WITHOUT_HINT(true),
    USER_MAPPINGS(false);

    private final boolean aiAssisted;

    MappingStrategy(boolean aiAssisted) {
        this.aiAssisted = aiAssisted;
    }

    public boolean isAiAssisted() {
        return aiAssisted;
    }

    /** Strategies that apply a stored format's column mappings. */
    public boolean usesRegistryFormat() {
        return this == REGISTRY_HIGH || this == REGISTRY_MEDIUM || this == LEGACY_MATCH;
    }
}
