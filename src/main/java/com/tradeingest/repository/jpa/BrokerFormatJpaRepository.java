package com.tradeingest.repository.jpa;

import com.tradeingest.entity.BrokerFormatEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the broker_formats table.
 */
@Repository
public interface BrokerFormatJpaRepository extends JpaRepository<BrokerFormatEntity, String> {

    Optional<BrokerFormatEntity> findFirstByFingerprint(String fingerprint);

    List<BrokerFormatEntity> findAllByOrderByCreatedAtAsc();
}
