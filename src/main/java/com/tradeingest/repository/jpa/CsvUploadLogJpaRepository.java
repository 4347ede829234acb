package com.tradeingest.repository.jpa;

import com.tradeingest.entity.CsvUploadLogEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CsvUploadLogJpaRepository extends JpaRepository<CsvUploadLogEntity, String> {

    Optional<CsvUploadLogEntity> findFirstByImportBatchId(String importBatchId);
}
