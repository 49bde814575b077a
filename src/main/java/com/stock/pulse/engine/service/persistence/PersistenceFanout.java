package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.common.exception.PersistenceTierUnavailableException;
import com.stock.pulse.engine.enums.SinkCriticality;
import com.stock.pulse.engine.model.canonical.CanonicalFields;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one canonical record through every storage tier in order.
 * <ul>
 *   <li>AUTHORITATIVE failure: raised as {@link PersistenceTierUnavailableException}, later sinks do not run</li>
 *   <li>BEST_EFFORT failure: logged and reported, the remaining sinks still run</li>
 * </ul>
 */
@Slf4j
@Service
public class PersistenceFanout {

    private final List<PersistenceSink> sinks;
    private final PipelineProperties props;
    private final Clock clock;

    public PersistenceFanout(List<PersistenceSink> sinks, PipelineProperties props, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.props = props;
        this.clock = clock;
    }

    public FanoutReport persist(String symbol, CanonicalFields fields) {
        return persist(symbol, fields, PersistContext.adhoc(props.getSource(), clock.instant()));
    }

    public FanoutReport persist(String symbol, CanonicalFields fields, PersistContext ctx) {
        return persist(CanonicalRecord.of(symbol, fields, ctx.asOf()), ctx);
    }

    public FanoutReport persist(CanonicalRecord record, PersistContext ctx) {
        List<FanoutReport.SinkOutcome> outcomes = new ArrayList<>(sinks.size());
        for (PersistenceSink sink : sinks) {
            try {
                sink.write(record, ctx);
                outcomes.add(new FanoutReport.SinkOutcome(sink.name(), sink.criticality(), true, null));
            } catch (RuntimeException e) {
                if (sink.criticality() == SinkCriticality.AUTHORITATIVE) {
                    log.error("Authoritative sink {} failed for {}: {}", sink.name(), record.getSymbol(), e.toString());
                    if (e instanceof PersistenceTierUnavailableException ptue) throw ptue;
                    throw new PersistenceTierUnavailableException(sink.name(),
                            "Sink " + sink.name() + " unavailable writing " + record.getSymbol() + ": " + e.getMessage(), e);
                }
                log.warn("Best-effort sink {} failed for {}: {}", sink.name(), record.getSymbol(), e.toString());
                outcomes.add(new FanoutReport.SinkOutcome(sink.name(), sink.criticality(), false, e.getMessage()));
            }
        }
        return new FanoutReport(record.getSymbol(), record, outcomes);
    }

    public List<String> sinkNames() {
        return sinks.stream().map(PersistenceSink::name).toList();
    }
}
