package com.stock.pulse.engine.service.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of an extraction job, safe to hand out while the job is still running.
 */
@Value
@Builder
public class JobSnapshot {
    String jobId;
    String extractionType;
    String status;
    List<String> symbols;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    int totalSymbols;
    int processedSymbols;
    int successfulSymbols;
    int failedSymbols;
    int skippedSymbols;
    double progressPercent;
    long dataPoints;
    boolean cancelRequested;
    String fatalError;
    String fatalErrorCode;
    List<SymbolOutcome> errors;
    List<SymbolOutcome> outcomes;
    Double durationSeconds;
}
