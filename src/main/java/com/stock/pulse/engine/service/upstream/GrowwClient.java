package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.AuthenticationException;
import com.stock.pulse.engine.common.exception.BasePipelineException;
import com.stock.pulse.engine.common.exception.NormalizationException;
import com.stock.pulse.engine.common.exception.RateLimitExceededException;
import com.stock.pulse.engine.common.exception.TransientNetworkException;
import com.stock.pulse.engine.common.exception.UpstreamCallException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Quote client for the upstream market-data API.
 * <p>
 * Every call takes a permit from the shared {@link RequestBudget}, is retried on transient
 * failures with exponential backoff, and re-authenticates once per request on a 401.
 */
@Slf4j
@Service
public class GrowwClient {

    private final UpstreamTransport transport;
    private final GrowwSessionService session;
    private final RequestBudget budget;
    private final UpstreamCallMetrics metrics;
    private final UpstreamProperties props;
    private final QuotePayloadParser parser;
    private final Clock clock;
    private final Retry retry;

    public GrowwClient(UpstreamTransport transport,
                       GrowwSessionService session,
                       RequestBudget budget,
                       UpstreamCallMetrics metrics,
                       UpstreamProperties props,
                       ObjectMapper mapper,
                       Clock clock) {
        this.transport = transport;
        this.session = session;
        this.budget = budget;
        this.metrics = metrics;
        this.props = props;
        this.parser = new QuotePayloadParser(mapper);
        this.clock = clock;
        this.retry = Retry.of("upstream-quote", RetryConfig.custom()
                .maxAttempts(Math.max(1, props.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, props.getInitialBackoff().toMillis()), props.getBackoffMultiplier()))
                .retryExceptions(TransientNetworkException.class)
                .build());
        this.retry.getEventPublisher().onRetry(e -> {
            metrics.recordRetry();
            log.debug("Retrying {} (attempt {}): {}", e.getName(), e.getNumberOfRetryAttempts(),
                    e.getLastThrowable() == null ? "-" : e.getLastThrowable().getMessage());
        });
    }

    public UpstreamRequest requestFor(String symbol) {
        return UpstreamRequest.of(symbol, props.getExchange(), props.getSegment());
    }

    /**
     * Fetches and decodes one quote.
     *
     * @throws AuthenticationException when the session cannot be (re)established
     * @throws UpstreamCallException   when retries ran out or the upstream refused the request
     * @throws NormalizationException  when the answer matches no known payload layout
     */
    public UpstreamQuote fetch(UpstreamRequest request) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean reauthenticated = new AtomicBoolean(false);
        long t0 = System.nanoTime();
        try {
            UpstreamQuote q = retry.executeCallable(() -> attempt(request, attempts, reauthenticated, t0));
            metrics.recordSuccess(q.latencyMs());
            return q;
        } catch (TransientNetworkException e) {
            metrics.recordFailure(request.symbol(), e.getMessage());
            throw new UpstreamCallException(request.symbol(), e.getStatus(), attempts.get(),
                    "Upstream call for " + request.symbol() + " failed after " + attempts.get() + " attempts: " + e.getMessage(), e);
        } catch (UpstreamCallException e) {
            metrics.recordFailure(request.symbol(), e.getMessage());
            throw new UpstreamCallException(request.symbol(), e.getLastStatus(), attempts.get(), e.getMessage(), e.getCause());
        } catch (BasePipelineException e) {
            metrics.recordFailure(request.symbol(), e.getMessage());
            throw e;
        } catch (Exception e) {
            metrics.recordFailure(request.symbol(), e.toString());
            throw new UpstreamCallException(request.symbol(), 0, attempts.get(),
                    "Unexpected error fetching " + request.symbol() + ": " + e, e);
        }
    }

    private UpstreamQuote attempt(UpstreamRequest request, AtomicInteger attempts,
                                  AtomicBoolean reauthenticated, long t0) {
        attempts.incrementAndGet();
        UpstreamResponse resp = send(request, session.getValidToken());

        if (resp.status() == 401) {
            if (!reauthenticated.compareAndSet(false, true)) {
                throw new AuthenticationException("Upstream rejected a refreshed token for " + request.symbol());
            }
            log.info("401 for {}, refreshing session", request.symbol());
            session.invalidate();
            resp = send(request, session.getValidToken());
            if (resp.status() == 401) {
                throw new AuthenticationException("Upstream rejected a refreshed token for " + request.symbol());
            }
        }

        int sc = resp.status();
        if (sc == 429) {
            metrics.recordThrottled();
            throw new RateLimitExceededException("Upstream throttled " + request.symbol());
        }
        if (sc >= 500) throw new TransientNetworkException(sc, "Upstream HTTP " + sc + " for " + request.symbol());
        if (!resp.is2xx()) {
            throw new UpstreamCallException(request.symbol(), sc, attempts.get(),
                    "Upstream HTTP " + sc + " for " + request.symbol() + ": " + abbreviate(resp.body()), null);
        }

        QuotePayloadParser.Decoded decoded = parser.parse(request.symbol(), sc, resp.body());
        long latencyMs = (System.nanoTime() - t0) / 1_000_000L;
        return new UpstreamQuote(request.symbol(), decoded.shape(), decoded.fields(), clock.instant(), latencyMs, attempts.get());
    }

    private UpstreamResponse send(UpstreamRequest request, String token) {
        try {
            budget.acquire();
            return transport.execute(request, token);
        } catch (IOException e) {
            throw new TransientNetworkException(0, "I/O error for " + request.symbol() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamCallException(request.symbol(), 0, 0, "Interrupted fetching " + request.symbol(), e);
        }
    }

    public Map<UpstreamRequest, FetchOutcome> fetchBulk(List<UpstreamRequest> requests, int concurrency) {
        return fetchBulk(requests, concurrency, BulkFetchListener.NONE);
    }

    /**
     * Fetches many quotes on a bounded worker pool under the shared budget.
     * A job-fatal error (from the fetch or from the listener) stops requests not yet started;
     * they come back as skipped. The result preserves request order.
     */
    public Map<UpstreamRequest, FetchOutcome> fetchBulk(List<UpstreamRequest> requests, int concurrency,
                                                        BulkFetchListener listener) {
        int workers = Math.max(1, Math.min(concurrency, Math.max(1, requests.size())));
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        AtomicReference<BasePipelineException> fatal = new AtomicReference<>();

        Map<UpstreamRequest, Future<FetchOutcome>> futures = new LinkedHashMap<>();
        for (UpstreamRequest r : requests) {
            if (!futures.containsKey(r)) futures.put(r, pool.submit(() -> fetchOne(r, listener, fatal)));
        }
        pool.shutdown();

        Map<UpstreamRequest, FetchOutcome> out = new LinkedHashMap<>();
        for (Map.Entry<UpstreamRequest, Future<FetchOutcome>> e : futures.entrySet()) {
            try {
                out.put(e.getKey(), e.getValue().get());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
                out.put(e.getKey(), FetchOutcome.skipped(e.getKey(), "interrupted"));
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                BasePipelineException err = cause instanceof BasePipelineException bpe ? bpe
                        : new UpstreamCallException(e.getKey().symbol(), 0, 0, String.valueOf(cause), cause);
                out.put(e.getKey(), FetchOutcome.failed(e.getKey(), err, 0L));
            }
        }
        return out;
    }

    private FetchOutcome fetchOne(UpstreamRequest r, BulkFetchListener listener,
                                  AtomicReference<BasePipelineException> fatal) {
        BasePipelineException abort = fatal.get();
        if (abort != null) return FetchOutcome.skipped(r, "aborted: " + abort.getMessage());
        if (listener.shouldStop()) return FetchOutcome.skipped(r, "cancelled");

        listener.onStart(r);
        long t0 = System.nanoTime();
        FetchOutcome outcome;
        try {
            outcome = FetchOutcome.success(r, fetch(r));
        } catch (BasePipelineException e) {
            if (e.isFatalForJob()) fatal.compareAndSet(null, e);
            log.warn("Fetch failed for {}: {}", r.symbol(), e.getMessage());
            outcome = FetchOutcome.failed(r, e, (System.nanoTime() - t0) / 1_000_000L);
        }
        try {
            listener.onComplete(outcome);
        } catch (BasePipelineException e) {
            if (!e.isFatalForJob()) throw e;
            fatal.compareAndSet(null, e);
        }
        return outcome;
    }

    public UpstreamCallMetrics.Snapshot metrics() {
        return metrics.snapshot(budget.waitCount());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "upstream-fetch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
