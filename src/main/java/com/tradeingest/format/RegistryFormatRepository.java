package com.tradeingest.format;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.entity.BrokerFormatEntity;
import com.tradeingest.mapper.BrokerFormatMapper;
import com.tradeingest.repository.jpa.BrokerFormatJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Format registry combining the seeded formats (held in memory) with learned formats stored in the
 * broker_formats table. Usage statistics of seeded formats live only for the process lifetime.
 */
@Repository
public class RegistryFormatRepository implements FormatRepository {

    private static final Logger log = LoggerFactory.getLogger(RegistryFormatRepository.class);

    private final BrokerFormatJpaRepository brokerFormatJpaRepository;
    private final BrokerFormatMapper brokerFormatMapper;
    private final Map<String, BrokerFormat> seeded = new LinkedHashMap<>();

    public RegistryFormatRepository(
            BrokerFormatJpaRepository brokerFormatJpaRepository, BrokerFormatMapper brokerFormatMapper) {
        this.brokerFormatJpaRepository = brokerFormatJpaRepository;
        this.brokerFormatMapper = brokerFormatMapper;
        SeededFormats.all().forEach(format -> seeded.put(format.getId(), format));
    }

    @Override
    public List<BrokerFormat> list() {
        List<BrokerFormat> formats;
        synchronized (seeded) {
            formats = new ArrayList<>(seeded.values());
        }
        formats.addAll(brokerFormatMapper.toDomainList(brokerFormatJpaRepository.findAllByOrderByCreatedAtAsc()));
        return formats;
    }

    @Override
    public BrokerFormat add(BrokerFormat format) {
        brokerFormatJpaRepository.save(brokerFormatMapper.toEntity(format));
        log.info("Registered format: id={} name={} fingerprint={}", format.getId(), format.getName(),
                format.getFingerprint());
        return format;
    }

    @Override
    public Optional<BrokerFormat> findById(String id) {
        synchronized (seeded) {
            BrokerFormat format = seeded.get(id);
            if (format != null) {
                return Optional.of(format);
            }
        }
        return brokerFormatJpaRepository.findById(id).map(brokerFormatMapper::toDomain);
    }

    @Override
    public Optional<BrokerFormat> findByFingerprint(String fingerprint) {
        synchronized (seeded) {
            Optional<BrokerFormat> seed = seeded.values().stream()
                    .filter(f -> fingerprint.equals(f.getFingerprint()))
                    .findFirst();
            if (seed.isPresent()) {
                return seed;
            }
        }
        return brokerFormatJpaRepository.findFirstByFingerprint(fingerprint).map(brokerFormatMapper::toDomain);
    }

    @Override
    public void recordUsage(String id, boolean success) {
        synchronized (seeded) {
            BrokerFormat format = seeded.get(id);
            if (format != null) {
                format.setSuccessRate(FormatFactory.nextSuccessRate(
                        format.getSuccessRate(), format.getUsageCount(), success));
                format.setUsageCount(format.getUsageCount() + 1);
                format.setUpdatedAt(LocalDateTime.now());
                return;
            }
        }
        Optional<BrokerFormatEntity> entity = brokerFormatJpaRepository.findById(id);
        if (entity.isEmpty()) {
            log.warn("recordUsage for unknown format id={}", id);
            return;
        }
        BrokerFormatEntity format = entity.get();
        format.setSuccessRate(FormatFactory.nextSuccessRate(format.getSuccessRate(), format.getUsageCount(), success));
        format.setUsageCount(format.getUsageCount() + 1);
        format.setUpdatedAt(LocalDateTime.now());
        brokerFormatJpaRepository.save(format);
    }
}
