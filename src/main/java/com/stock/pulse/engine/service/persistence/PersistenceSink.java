package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.enums.SinkCriticality;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;

/**
 * One storage tier the fan-out writes to. Sinks run in {@code @Order} order.
 */
public interface PersistenceSink {

    String name();

    SinkCriticality criticality();

    void write(CanonicalRecord record, PersistContext ctx);
}
