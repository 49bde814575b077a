package com.stock.pulse.engine.test.repo;

import com.stock.pulse.engine.model.documents.ExtractionAuditLog;
import com.stock.pulse.engine.repo.documents.ExtractionAuditLogRepo;
import com.stock.pulse.engine.test.BaseContainers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@ActiveProfiles("test")
class ExtractionAuditLogRepoIT extends BaseContainers {

    @Autowired
    ExtractionAuditLogRepo auditRepo;

    @Test
    void everyExtractionIsKeptAndTheLatestIsFound() {
        auditRepo.deleteAll();
        Instant now = Instant.now();
        auditRepo.save(log("j1", now.minusSeconds(900), 2950.0));
        auditRepo.save(log("j2", now, 2961.0));

        assertThat(auditRepo.countByJobId("j1")).isEqualTo(1);
        assertThat(auditRepo.findByJobId("j2")).hasSize(1);
        ExtractionAuditLog latest = auditRepo.findTopBySymbolOrderByTsDesc("RELIANCE").orElseThrow();
        assertThat(latest.getJobId()).isEqualTo("j2");
        assertThat(latest.getFields()).containsEntry("current_price", 2961.0);
    }

    private static ExtractionAuditLog log(String jobId, Instant ts, double price) {
        return ExtractionAuditLog.builder()
                .jobId(jobId)
                .symbol("RELIANCE")
                .source("groww")
                .ts(ts)
                .payloadShape("FLAT")
                .fieldCount(1)
                .fields(Map.of("current_price", price))
                .warnings(List.of())
                .build();
    }
}
