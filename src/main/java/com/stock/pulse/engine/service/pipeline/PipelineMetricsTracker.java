package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.enums.JobStatus;
import com.stock.pulse.engine.enums.SymbolStatus;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregates across finished jobs. PARTIAL counts as a successful job.
 */
@Component
public class PipelineMetricsTracker {

    private final Clock clock;
    private final Instant uptimeSince;

    private long totalJobs;
    private long successfulJobs;
    private long failedJobs;
    private long symbolsProcessed;
    private long dataPoints;
    private double totalDurationSeconds;
    private long timedJobs;
    private Instant lastRunTime;
    private Instant nextScheduledRun;
    private int expectedSymbols;
    private int receivedSymbols;
    private List<String> missingSymbols = List.of();

    public PipelineMetricsTracker(Clock clock) {
        this.clock = clock;
        this.uptimeSince = clock.instant();
    }

    public synchronized void recordJob(ExtractionJob job) {
        JobSnapshot s = job.toSnapshot();
        totalJobs++;
        if (job.getStatus() == JobStatus.FAILED) failedJobs++;
        else successfulJobs++;
        symbolsProcessed += s.getProcessedSymbols();
        dataPoints += s.getDataPoints();
        if (s.getDurationSeconds() != null) {
            totalDurationSeconds += s.getDurationSeconds();
            timedJobs++;
        }
        lastRunTime = s.getCompletedAt();
        expectedSymbols = s.getTotalSymbols();
        receivedSymbols = s.getSuccessfulSymbols();
        missingSymbols = job.outcomes().stream()
                .filter(o -> o.getStatus() != SymbolStatus.SUCCESS)
                .map(SymbolOutcome::getSymbol)
                .toList();
    }

    public synchronized void setNextScheduledRun(Instant next) {
        this.nextScheduledRun = next;
    }

    public synchronized MetricsSnapshot snapshot() {
        int missingShown = Math.min(missingSymbols.size(), PipelineConsts.Jobs.MISSING_SYMBOLS_REPORTED);
        return MetricsSnapshot.builder()
                .totalJobsRun(totalJobs)
                .successfulJobs(successfulJobs)
                .failedJobs(failedJobs)
                .jobSuccessRate(totalJobs == 0 ? 0.0 : round2(successfulJobs * 100.0 / totalJobs))
                .totalSymbolsProcessed(symbolsProcessed)
                .totalDataPointsExtracted(dataPoints)
                .avgJobDurationSeconds(timedJobs == 0 ? 0.0 : round2(totalDurationSeconds / timedJobs))
                .lastRunTime(lastRunTime)
                .nextScheduledRun(nextScheduledRun)
                .uptimeSeconds(Duration.between(uptimeSince, clock.instant()).getSeconds())
                .expectedSymbols(expectedSymbols)
                .receivedSymbols(receivedSymbols)
                .dataCompletenessPercent(expectedSymbols == 0 ? 0.0 : round2(receivedSymbols * 100.0 / expectedSymbols))
                .missingSymbolsCount(missingSymbols.size())
                .missingSymbols(List.copyOf(missingSymbols.subList(0, missingShown)))
                .build();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    @Value
    @Builder
    public static class MetricsSnapshot {
        long totalJobsRun;
        long successfulJobs;
        long failedJobs;
        double jobSuccessRate;
        long totalSymbolsProcessed;
        long totalDataPointsExtracted;
        double avgJobDurationSeconds;
        Instant lastRunTime;
        Instant nextScheduledRun;
        long uptimeSeconds;
        int expectedSymbols;
        int receivedSymbols;
        double dataCompletenessPercent;
        int missingSymbolsCount;
        List<String> missingSymbols;
    }
}
