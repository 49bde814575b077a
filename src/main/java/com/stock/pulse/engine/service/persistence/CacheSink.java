package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.enums.SinkCriticality;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class CacheSink implements PersistenceSink {

    private final CacheService cache;

    public CacheSink(CacheService cache) {
        this.cache = cache;
    }

    @Override
    public String name() {
        return "cache";
    }

    @Override
    public SinkCriticality criticality() {
        return SinkCriticality.BEST_EFFORT;
    }

    @Override
    public void write(CanonicalRecord record, PersistContext ctx) {
        cache.cacheQuote(record);
    }
}
