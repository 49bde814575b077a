package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.enums.SinkCriticality;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Authoritative tier. Runs first, so the technicals it may compute reach the later sinks.
 */
@Slf4j
@Component
@Order(1)
public class TimeSeriesSink implements PersistenceSink {

    private final TimeSeriesStore store;

    public TimeSeriesSink(TimeSeriesStore store) {
        this.store = store;
    }

    @Override
    public String name() {
        return "timeseries";
    }

    @Override
    public SinkCriticality criticality() {
        return SinkCriticality.AUTHORITATIVE;
    }

    @Override
    public void write(CanonicalRecord record, PersistContext ctx) {
        try {
            store.upsert(record);
        } catch (DataIntegrityViolationException race) {
            // another writer inserted the same natural key first; the retry updates its row
            log.debug("Upsert race for {}, retrying", record.getSymbol());
            store.upsert(record);
        }
    }
}
