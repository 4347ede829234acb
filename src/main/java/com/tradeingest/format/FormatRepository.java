package com.tradeingest.format;

import com.tradeingest.domain.model.BrokerFormat;
import java.util.List;
import java.util.Optional;

/**
 * Storage-agnostic view of the format registry. The detector only ever reads {@link #list()}, so
 * seeded, database-backed and in-memory registries are interchangeable.
 */
public interface FormatRepository {

    /** Every known format, seeded first, then learned formats in creation order. */
    List<BrokerFormat> list();

    BrokerFormat add(BrokerFormat format);

    Optional<BrokerFormat> findById(String id);

    Optional<BrokerFormat> findByFingerprint(String fingerprint);

    /** Bumps the usage count and folds the outcome into the running success rate. */
    void recordUsage(String id, boolean success);
}
