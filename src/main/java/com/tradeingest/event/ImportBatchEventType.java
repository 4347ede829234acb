package com.tradeingest.event;

/**
 * Classifies the lifecycle transition behind an {@link ImportBatchEvent}.
 *
 * <p>CREATED -> PROCESSING -> COMPLETED/FAILED, with REVIEW_REQUIRED and BROKER_SELECTION_REQUIRED
 * marking batches parked at PENDING.
 */
public enum ImportBatchEventType {

    /** Batch row created for a new upload. */
    CREATED,

    /** Rows are being applied. */
    PROCESSING,

    /** Processing finished with at least one row not in error. */
    COMPLETED,

    /** Every row failed, or the user rejected the proposed mapping. */
    FAILED,

    /** An AI-proposed mapping is waiting for the user to confirm it. */
    REVIEW_REQUIRED,

    /** The layout is unknown and the user must name the broker first. */
    BROKER_SELECTION_REQUIRED,

    /** The mapping service failed; the upload was kept at PENDING for a retry. */
    AI_MAPPING_FAILED
}
