package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.enums.SymbolStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What happened to one symbol within a job.
 */
@Value
@Builder
public class SymbolOutcome {
    String symbol;
    SymbolStatus status;
    String errorType;
    String errorCode;
    String message;
    Integer lastHttpStatus;
    int attempts;
    long latencyMs;
    int fieldCount;
    List<String> warnings;
    Double changePct;
    Instant completedAt;

    public static SymbolOutcome skipped(String symbol, String reason, Instant at) {
        return SymbolOutcome.builder()
                .symbol(symbol)
                .status(SymbolStatus.SKIPPED)
                .message(reason)
                .warnings(List.of())
                .completedAt(at)
                .build();
    }
}
