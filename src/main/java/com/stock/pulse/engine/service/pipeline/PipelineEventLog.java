package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.common.constants.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, in-memory structured log of pipeline events. Oldest entries fall off first.
 */
@Slf4j
@Component
public class PipelineEventLog {

    private final Deque<PipelineEvent> events = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;

    public PipelineEventLog(PipelineProperties props, Clock clock) {
        this.capacity = Math.max(1, props.getEventLogSize());
        this.clock = clock;
    }

    public PipelineEvent log(String eventType, Map<String, Object> data) {
        PipelineEvent e = new PipelineEvent(clock.instant(), eventType,
                data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data)));
        synchronized (events) {
            events.addLast(e);
            while (events.size() > capacity) events.removeFirst();
        }
        log.info("Pipeline event: {} - {}", eventType, e.data());
        return e;
    }

    /**
     * Most recent events, oldest first, optionally filtered by type.
     */
    public List<PipelineEvent> recent(String eventType, int limit) {
        List<PipelineEvent> out = new ArrayList<>();
        if (limit <= 0) return out;
        synchronized (events) {
            Iterator<PipelineEvent> it = events.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                PipelineEvent e = it.next();
                if (eventType == null || eventType.isBlank() || eventType.equals(e.eventType())) out.add(e);
            }
        }
        Collections.reverse(out);
        return out;
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }

    public record PipelineEvent(Instant timestamp, String eventType, Map<String, Object> data) {
    }
}
