package com.tradeingest.event;

import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.model.ImportBatch;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed methods for import
 * batch transitions. Delivery is synchronous unless a listener opts into {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishBatchCreated(Object source, ImportBatch batch) {
        applicationEventPublisher.publishEvent(new ImportBatchEvent(source, batch, ImportBatchEventType.CREATED));
    }

    public void publishBatchProcessing(Object source, ImportBatch batch, ImportBatchStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new ImportBatchEvent(source, batch, ImportBatchEventType.PROCESSING, previousStatus, null));
    }

    public void publishBatchCompleted(
            Object source, ImportBatch batch, ImportBatchStatus previousStatus, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new ImportBatchEvent(source, batch, ImportBatchEventType.COMPLETED, previousStatus, details));
    }

    public void publishBatchFailed(
            Object source, ImportBatch batch, ImportBatchStatus previousStatus, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new ImportBatchEvent(source, batch, ImportBatchEventType.FAILED, previousStatus, details));
    }

    public void publishReviewRequired(Object source, ImportBatch batch) {
        applicationEventPublisher.publishEvent(
                new ImportBatchEvent(source, batch, ImportBatchEventType.REVIEW_REQUIRED));
    }

    public void publishBrokerSelectionRequired(Object source, ImportBatch batch) {
        applicationEventPublisher.publishEvent(
                new ImportBatchEvent(source, batch, ImportBatchEventType.BROKER_SELECTION_REQUIRED));
    }

    public void publishAiMappingFailed(Object source, ImportBatch batch, String reason) {
        applicationEventPublisher.publishEvent(new ImportBatchEvent(
                source, batch, ImportBatchEventType.AI_MAPPING_FAILED, batch.getStatus(), Map.of("reason", reason)));
    }
}
