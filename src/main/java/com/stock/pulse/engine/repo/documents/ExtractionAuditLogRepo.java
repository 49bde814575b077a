package com.stock.pulse.engine.repo.documents;

import com.stock.pulse.engine.model.documents.ExtractionAuditLog;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExtractionAuditLogRepo extends MongoRepository<ExtractionAuditLog, String> {

    /**
     * Latest snapshot for a symbol, across jobs.
     */
    Optional<ExtractionAuditLog> findTopBySymbolOrderByTsDesc(String symbol);

    List<ExtractionAuditLog> findByJobId(String jobId);

    long countByJobId(String jobId);
}
