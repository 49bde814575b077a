package com.stock.pulse.engine.service.upstream;

import com.stock.pulse.engine.common.constants.PipelineConsts;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for upstream quote calls, kept since process start.
 */
@Component
public class UpstreamCallMetrics {

    private final Clock clock;

    private final LongAdder total = new LongAdder();
    private final LongAdder successful = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder throttled = new LongAdder();
    private final LongAdder latencySumMs = new LongAdder();
    private final AtomicLong minLatencyMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxLatencyMs = new AtomicLong(0);
    private final Deque<String> recentErrors = new ArrayDeque<>();
    private volatile Instant lastRequestAt;

    public UpstreamCallMetrics(Clock clock) {
        this.clock = clock;
    }

    void recordSuccess(long latencyMs) {
        total.increment();
        successful.increment();
        latencySumMs.add(latencyMs);
        minLatencyMs.accumulateAndGet(latencyMs, Math::min);
        maxLatencyMs.accumulateAndGet(latencyMs, Math::max);
        lastRequestAt = clock.instant();
    }

    void recordFailure(String symbol, String error) {
        total.increment();
        failed.increment();
        lastRequestAt = clock.instant();
        synchronized (recentErrors) {
            recentErrors.addLast(lastRequestAt + " " + symbol + ": " + error);
            while (recentErrors.size() > PipelineConsts.Jobs.RECENT_UPSTREAM_ERRORS) recentErrors.removeFirst();
        }
    }

    void recordRetry() {
        retries.increment();
    }

    void recordThrottled() {
        throttled.increment();
    }

    public Snapshot snapshot(long rateLimitWaits) {
        long ok = successful.sum();
        long all = total.sum();
        List<String> errors;
        synchronized (recentErrors) {
            errors = new ArrayList<>(recentErrors);
        }
        return Snapshot.builder()
                .totalRequests(all)
                .successfulRequests(ok)
                .failedRequests(failed.sum())
                .retryCount(retries.sum())
                .rateLimitHits(throttled.sum())
                .rateLimitWaits(rateLimitWaits)
                .avgLatencyMs(ok == 0 ? 0.0 : (double) latencySumMs.sum() / ok)
                .minLatencyMs(ok == 0 ? 0L : minLatencyMs.get())
                .maxLatencyMs(maxLatencyMs.get())
                .successRate(all == 0 ? 0.0 : ok * 100.0 / all)
                .lastRequestTime(lastRequestAt)
                .recentErrors(errors)
                .build();
    }

    @Value
    @Builder
    public static class Snapshot {
        long totalRequests;
        long successfulRequests;
        long failedRequests;
        long retryCount;
        long rateLimitHits;
        long rateLimitWaits;
        double avgLatencyMs;
        long minLatencyMs;
        long maxLatencyMs;
        double successRate;
        Instant lastRequestTime;
        List<String> recentErrors;
    }
}
