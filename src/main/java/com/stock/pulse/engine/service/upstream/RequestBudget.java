package com.stock.pulse.engine.service.upstream;

import com.stock.pulse.engine.common.constants.UpstreamProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * Global upstream request budget shared by every caller: a per-second and a per-minute window.
 * A caller over budget waits for the next window; permits are never skipped.
 */
@Slf4j
@Component
public class RequestBudget {

    private static final long WAIT_REPORT_NANOS = 1_000_000L;

    private final RateLimiter perSecond;
    private final RateLimiter perMinute;
    private final LongAdder waits = new LongAdder();

    public RequestBudget(UpstreamProperties props) {
        this.perMinute = RateLimiter.of("upstream-per-minute", RateLimiterConfig.custom()
                .limitForPeriod(props.getRequestsPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(props.getPermitTimeout())
                .build());
        this.perSecond = RateLimiter.of("upstream-per-second", RateLimiterConfig.custom()
                .limitForPeriod(props.getRequestsPerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(props.getPermitTimeout())
                .build());
    }

    /**
     * Blocks until both windows grant a permit.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void acquire() throws InterruptedException {
        long t0 = System.nanoTime();
        take(perMinute);
        take(perSecond);
        if (System.nanoTime() - t0 > WAIT_REPORT_NANOS) waits.increment();
    }

    /**
     * Number of calls that had to wait for a permit.
     */
    public long waitCount() {
        return waits.sum();
    }

    private static void take(RateLimiter limiter) throws InterruptedException {
        while (!limiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Interrupted waiting for " + limiter.getName());
            log.debug("Still waiting for a {} permit", limiter.getName());
        }
    }
}
