package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.enums.SinkCriticality;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;

import java.util.List;

public record FanoutReport(String symbol, CanonicalRecord record, List<SinkOutcome> sinks) {

    public boolean allSucceeded() {
        return sinks.stream().allMatch(SinkOutcome::ok);
    }

    public List<String> failedSinks() {
        return sinks.stream().filter(s -> !s.ok()).map(SinkOutcome::sink).toList();
    }

    public record SinkOutcome(String sink, SinkCriticality criticality, boolean ok, String error) {
    }
}
