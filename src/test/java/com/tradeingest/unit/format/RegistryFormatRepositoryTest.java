package com.tradeingest.unit.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.entity.BrokerFormatEntity;
import com.tradeingest.format.RegistryFormatRepository;
import com.tradeingest.format.SeededFormats;
import com.tradeingest.mapper.BrokerFormatMapper;
import com.tradeingest.repository.jpa.BrokerFormatJpaRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for RegistryFormatRepository combining in-memory seeds with stored learned formats. */
class RegistryFormatRepositoryTest {

    private BrokerFormatJpaRepository brokerFormatJpaRepository;
    private BrokerFormatMapper brokerFormatMapper;
    private RegistryFormatRepository repository;

    @BeforeEach
    void setUp() {
        brokerFormatJpaRepository = mock(BrokerFormatJpaRepository.class);
        brokerFormatMapper = mock(BrokerFormatMapper.class);
        repository = new RegistryFormatRepository(brokerFormatJpaRepository, brokerFormatMapper);
    }

    @Test
    @DisplayName("Seeds come first, then learned formats in creation order")
    void listOrder() {
        BrokerFormatEntity entity = new BrokerFormatEntity();
        BrokerFormat learned = BrokerFormat.builder().id("learned-1").name("Acme Format 1").build();
        when(brokerFormatJpaRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(entity));
        when(brokerFormatMapper.toDomainList(List.of(entity))).thenReturn(List.of(learned));

        List<BrokerFormat> formats = repository.list();

        assertThat(formats).hasSize(SeededFormats.all().size() + 1);
        assertThat(formats.get(0).getId()).isEqualTo(SeededFormats.IBKR_FLEX);
        assertThat(formats.get(formats.size() - 1).getId()).isEqualTo("learned-1");
    }

    @Test
    @DisplayName("Usage of a seeded format is tracked in memory without touching the table")
    void seededUsage() {
        repository.recordUsage(SeededFormats.IBKR_FLEX, true);
        repository.recordUsage(SeededFormats.IBKR_FLEX, false);

        BrokerFormat seed = repository.findById(SeededFormats.IBKR_FLEX).orElseThrow();
        assertThat(seed.getUsageCount()).isEqualTo(2);
        assertThat(seed.getSuccessRate()).isEqualTo(0.5);
        verify(brokerFormatJpaRepository, never()).save(any());
    }

    @Test
    @DisplayName("Usage of a learned format updates and saves its row")
    void learnedUsage() {
        BrokerFormatEntity entity = new BrokerFormatEntity();
        entity.setId("learned-1");
        entity.setUsageCount(3);
        entity.setSuccessRate(1.0);
        when(brokerFormatJpaRepository.findById("learned-1")).thenReturn(Optional.of(entity));

        repository.recordUsage("learned-1", false);

        assertThat(entity.getUsageCount()).isEqualTo(4);
        assertThat(entity.getSuccessRate()).isEqualTo(0.75);
        verify(brokerFormatJpaRepository).save(entity);
    }

    @Test
    @DisplayName("Unknown format id is ignored")
    void unknownUsage() {
        when(brokerFormatJpaRepository.findById("missing")).thenReturn(Optional.empty());

        repository.recordUsage("missing", true);

        verify(brokerFormatJpaRepository, never()).save(any());
    }

    @Test
    @DisplayName("Fingerprint lookup prefers seeds")
    void fingerprintLookup() {
        BrokerFormat ibkr = repository.findById(SeededFormats.IBKR_FLEX).orElseThrow();

        assertThat(repository.findByFingerprint(ibkr.getFingerprint())).contains(ibkr);
    }
}
