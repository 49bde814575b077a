package com.stock.pulse.engine.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Figures derived from stored history, used to cross-check a live record.
 * Any of them may be null when history is too short.
 */
@Value
@Builder
public class HistoricalAggregates {

    public static final HistoricalAggregates EMPTY = HistoricalAggregates.builder().barCount(0).build();

    Double lastStoredClose;
    Double high52w;
    Double low52w;
    Double sma50;
    Double sma200;
    Double avgVolume20d;
    Double sectorPe;
    int barCount;
}
