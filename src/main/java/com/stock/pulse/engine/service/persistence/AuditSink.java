package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.enums.SinkCriticality;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.model.documents.ExtractionAuditLog;
import com.stock.pulse.engine.repo.documents.ExtractionAuditLogRepo;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insert-only audit trail of normalized snapshots.
 */
@Component
@Order(3)
public class AuditSink implements PersistenceSink {

    private final ExtractionAuditLogRepo repo;

    public AuditSink(ExtractionAuditLogRepo repo) {
        this.repo = repo;
    }

    @Override
    public String name() {
        return "audit";
    }

    @Override
    public SinkCriticality criticality() {
        return SinkCriticality.BEST_EFFORT;
    }

    @Override
    public void write(CanonicalRecord record, PersistContext ctx) {
        Map<String, Object> fields = new LinkedHashMap<>();
        record.getValues().forEach((k, v) -> fields.put(k, storable(v)));
        repo.insert(ExtractionAuditLog.builder()
                .jobId(ctx.jobId())
                .symbol(record.getSymbol())
                .source(ctx.source())
                .ts(ctx.asOf())
                .payloadShape(ctx.shape() == null ? null : ctx.shape().name())
                .fieldCount(fields.size())
                .fields(fields)
                .warnings(ctx.warnings())
                .build());
    }

    static Object storable(Object v) {
        if (v instanceof Instant || v instanceof LocalDate) return v.toString();
        return v;
    }
}
