package com.tradeingest.event;

import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.model.ImportBatch;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every import batch transition.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ImportMetricsService - counts imports, duplicates and mapping-service failures</li>
 * </ul>
 */
public class ImportBatchEvent extends ApplicationEvent {

    private final ImportBatch batch;
    private final ImportBatchEventType eventType;
    private final ImportBatchStatus previousStatus;
    private final Map<String, Object> details;

    public ImportBatchEvent(
            Object source,
            ImportBatch batch,
            ImportBatchEventType eventType,
            ImportBatchStatus previousStatus,
            Map<String, Object> details) {
        super(source);
        this.batch = batch;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public ImportBatchEvent(Object source, ImportBatch batch, ImportBatchEventType eventType) {
        this(source, batch, eventType, null, null);
    }

    public ImportBatch getBatch() {
        return batch;
    }

    public ImportBatchEventType getEventType() {
        return eventType;
    }

    /** The batch status before this event. Null for CREATED events. */
    public ImportBatchStatus getPreviousStatus() {
        return previousStatus;
    }

    /** Extra facts about the transition, for example {@code duplicates} on COMPLETED. */
    public Map<String, Object> getDetails() {
        return details;
    }
}
