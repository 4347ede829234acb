package com.tradeingest.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an import batch.
 *
 * <p>PENDING batches wait for a broker selection or a mapping approval and may stay there
 * indefinitely. COMPLETED and FAILED are terminal.
 */
public enum ImportBatchStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ImportBatchStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<ImportBatchStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PROCESSING, FAILED);
            case PROCESSING:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(ImportBatchStatus.class);
        }
    }
}
