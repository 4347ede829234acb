package com.tradeingest.observability;

import com.tradeingest.event.ImportBatchEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for CSV ingestion, driven by {@link ImportBatchEvent}s:
 * <ul>
 *   <li><b>imports.started</b> (counter): batches created</li>
 *   <li><b>imports.completed</b> / <b>imports.failed</b> (counters): terminal outcomes</li>
 *   <li><b>imports.review.required</b> (counter): batches parked for mapping review or broker selection</li>
 *   <li><b>imports.rows.duplicate</b> (counter): rows skipped by the duplicate guard</li>
 *   <li><b>imports.ai.failures</b> (counter): mapping-service failures</li>
 *   <li><b>imports.duration</b> (timer): processing start to terminal state</li>
 * </ul>
 */
@Service
public class ImportMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ImportMetricsService.class);

    private final Counter startedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter reviewRequiredCounter;
    private final Counter duplicateRowsCounter;
    private final Counter aiFailuresCounter;
    private final Timer durationTimer;

    public ImportMetricsService(MeterRegistry meterRegistry) {
        this.startedCounter = Counter.builder("imports.started")
                .description("Import batches created")
                .register(meterRegistry);
        this.completedCounter = Counter.builder("imports.completed")
                .description("Import batches that finished with at least one usable row")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("imports.failed")
                .description("Import batches that failed outright")
                .register(meterRegistry);
        this.reviewRequiredCounter = Counter.builder("imports.review.required")
                .description("Import batches parked for mapping review or broker selection")
                .register(meterRegistry);
        this.duplicateRowsCounter = Counter.builder("imports.rows.duplicate")
                .description("Rows skipped because an identical order was already imported")
                .register(meterRegistry);
        this.aiFailuresCounter = Counter.builder("imports.ai.failures")
                .description("Mapping service calls that failed or timed out")
                .register(meterRegistry);
        this.durationTimer = Timer.builder("imports.duration")
                .description("Time from processing start to a terminal batch state")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onImportBatchEvent(ImportBatchEvent event) {
        switch (event.getEventType()) {
            case CREATED -> startedCounter.increment();
            case COMPLETED -> {
                completedCounter.increment();
                recordDuplicates(event);
                recordDuration(event);
            }
            case FAILED -> {
                failedCounter.increment();
                recordDuplicates(event);
                recordDuration(event);
            }
            case REVIEW_REQUIRED, BROKER_SELECTION_REQUIRED -> reviewRequiredCounter.increment();
            case AI_MAPPING_FAILED -> aiFailuresCounter.increment();
            default -> log.trace("No metric for event type {}", event.getEventType());
        }
    }

    private void recordDuplicates(ImportBatchEvent event) {
        Object duplicates = event.getDetails().get("duplicates");
        if (duplicates instanceof Number count && count.longValue() > 0) {
            duplicateRowsCounter.increment(count.doubleValue());
        }
    }

    private void recordDuration(ImportBatchEvent event) {
        LocalDateTime started = event.getBatch().getProcessingStartedAt();
        LocalDateTime finished = event.getBatch().getProcessingCompletedAt();
        if (started != null && finished != null && !finished.isBefore(started)) {
            durationTimer.record(Duration.between(started, finished));
        }
    }
}
