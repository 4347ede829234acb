package com.tradeingest.unit.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.model.ImportBatch;
import com.tradeingest.entity.ImportBatchEntity;
import com.tradeingest.event.EventPublisherHelper;
import com.tradeingest.exception.InvalidBatchStateException;
import com.tradeingest.exception.ResourceNotFoundException;
import com.tradeingest.ingest.ImportBatchService;
import com.tradeingest.ingest.ImportTally;
import com.tradeingest.mapper.ImportBatchMapper;
import com.tradeingest.repository.jpa.ImportBatchJpaRepository;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for the import batch lifecycle. */
class ImportBatchServiceTest {

    private ImportBatchJpaRepository importBatchJpaRepository;
    private ImportBatchMapper importBatchMapper;
    private EventPublisherHelper eventPublisherHelper;
    private ImportBatchService service;

    @BeforeEach
    void setUp() {
        importBatchJpaRepository = mock(ImportBatchJpaRepository.class);
        importBatchMapper = mock(ImportBatchMapper.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        when(importBatchMapper.toEntity(any(ImportBatch.class))).thenReturn(new ImportBatchEntity());
        service = new ImportBatchService(importBatchJpaRepository, importBatchMapper, eventPublisherHelper);
    }

    @Test
    @DisplayName("create assigns an id, sets PENDING and publishes after saving")
    void create() {
        ImportBatch batch = service.create(ImportBatch.builder().userId("u1").filename("a.csv").build());

        assertThat(batch.getId()).isNotBlank();
        assertThat(batch.getStatus()).isEqualTo(ImportBatchStatus.PENDING);
        assertThat(batch.getCreatedAt()).isNotNull();
        verify(importBatchJpaRepository).save(any(ImportBatchEntity.class));
        verify(eventPublisherHelper).publishBatchCreated(service, batch);
    }

    @Nested
    @DisplayName("finish")
    class Finish {

        @Test
        @DisplayName("Completes when at least one record did not fail and drops the raw upload")
        void completes() {
            ImportBatch batch = processingBatch();
            ImportTally tally = new ImportTally(3);
            tally.success();
            tally.duplicate();
            tally.rowError(3, "Missing symbol");

            service.finish(batch, tally);

            assertThat(batch.getStatus()).isEqualTo(ImportBatchStatus.COMPLETED);
            assertThat(batch.getSuccessCount()).isEqualTo(1);
            assertThat(batch.getErrorCount()).isEqualTo(1);
            assertThat(batch.getErrors()).containsExactly("Row 3: Missing symbol");
            assertThat(batch.getRawContent()).isNull();
            assertThat(batch.getProcessingCompletedAt()).isNotNull();
            verify(eventPublisherHelper).publishBatchCompleted(
                    service, batch, ImportBatchStatus.PROCESSING, Map.of("duplicates", 1));
        }

        @Test
        @DisplayName("Fails when every record failed")
        void failsWhenAllRowsFail() {
            ImportBatch batch = processingBatch();
            ImportTally tally = new ImportTally(2);
            tally.rowError(1, "Missing side");
            tally.rowError(2, "Missing side");

            service.finish(batch, tally);

            assertThat(batch.getStatus()).isEqualTo(ImportBatchStatus.FAILED);
            verify(eventPublisherHelper).publishBatchFailed(
                    eq(service), eq(batch), eq(ImportBatchStatus.PROCESSING), anyMap());
            verify(eventPublisherHelper, never()).publishBatchCompleted(any(), any(), any(), anyMap());
        }

        @Test
        @DisplayName("Rejects a batch that never started processing")
        void rejectsPendingBatch() {
            ImportBatch batch = ImportBatch.builder().id("b1").status(ImportBatchStatus.PENDING).build();

            assertThatThrownBy(() -> service.finish(batch, new ImportTally(1)))
                    .isInstanceOf(InvalidBatchStateException.class);
            assertThat(batch.getStatus()).isEqualTo(ImportBatchStatus.PENDING);
        }
    }

    @Test
    @DisplayName("Terminal batches cannot be failed again")
    void terminalIsFinal() {
        ImportBatch batch = ImportBatch.builder().id("b1").status(ImportBatchStatus.COMPLETED).build();

        assertThatThrownBy(() -> service.fail(batch, "late")).isInstanceOf(InvalidBatchStateException.class);
        verify(importBatchJpaRepository, never()).save(any());
    }

    @Test
    @DisplayName("fail from PENDING records the reason and clears the raw upload")
    void failFromPending() {
        ImportBatch batch = ImportBatch.builder()
                .id("b1")
                .status(ImportBatchStatus.PENDING)
                .rawContent("a,b\n1,2\n")
                .build();

        service.fail(batch, "User cancelled import during mapping review");

        assertThat(batch.getStatus()).isEqualTo(ImportBatchStatus.FAILED);
        assertThat(batch.getErrors()).containsExactly("User cancelled import during mapping review");
        assertThat(batch.getRawContent()).isNull();
        assertThat(batch.getProcessingCompletedAt()).isNull();
    }

    @Test
    @DisplayName("startProcessing keeps the raw upload until the batch ends")
    void startProcessingKeepsRawContent() {
        ImportBatch batch = ImportBatch.builder()
                .id("b1")
                .status(ImportBatchStatus.PENDING)
                .rawContent("a,b\n1,2\n")
                .build();

        service.startProcessing(batch);

        assertThat(batch.getStatus()).isEqualTo(ImportBatchStatus.PROCESSING);
        assertThat(batch.getRawContent()).isEqualTo("a,b\n1,2\n");
        assertThat(batch.getProcessingStartedAt()).isNotNull();
    }

    @Test
    @DisplayName("recordAiFailure rejects a batch that already ended")
    void aiFailureOnTerminalBatch() {
        ImportBatch batch = ImportBatch.builder().id("b1").status(ImportBatchStatus.FAILED).build();

        assertThatThrownBy(() -> service.recordAiFailure(batch, "Mapping service unavailable"))
                .isInstanceOf(InvalidBatchStateException.class);
        assertThat(batch.getErrors()).isEmpty();
        verify(eventPublisherHelper, never()).publishAiMappingFailed(any(), any(), any());
    }

    @Test
    @DisplayName("park announces broker selection before review")
    void parkPublishesReason() {
        ImportBatch batch = ImportBatch.builder()
                .id("b1")
                .status(ImportBatchStatus.PENDING)
                .requiresBrokerSelection(true)
                .userReviewRequired(true)
                .build();

        service.park(batch);

        verify(eventPublisherHelper).publishBrokerSelectionRequired(service, batch);
        verify(eventPublisherHelper, never()).publishReviewRequired(any(), any());
    }

    @Test
    @DisplayName("get hides batches owned by another user")
    void getChecksOwner() {
        when(importBatchJpaRepository.findByIdAndUserId("b1", "intruder")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("b1", "intruder"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("ImportBatch not found: b1");
    }

    private static ImportBatch processingBatch() {
        return ImportBatch.builder()
                .id("b1")
                .userId("u1")
                .status(ImportBatchStatus.PROCESSING)
                .rawContent("raw")
                .build();
    }
}
