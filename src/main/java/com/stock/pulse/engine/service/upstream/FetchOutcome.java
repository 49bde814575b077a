package com.stock.pulse.engine.service.upstream;

import com.stock.pulse.engine.common.exception.BasePipelineException;

/**
 * What happened to one request of a bulk fetch. Exactly one of quote, error or skipReason is set.
 */
public record FetchOutcome(UpstreamRequest request,
                           UpstreamQuote quote,
                           BasePipelineException error,
                           String skipReason,
                           long latencyMs) {

    public static FetchOutcome success(UpstreamRequest r, UpstreamQuote q) {
        return new FetchOutcome(r, q, null, null, q.latencyMs());
    }

    public static FetchOutcome failed(UpstreamRequest r, BasePipelineException e, long latencyMs) {
        return new FetchOutcome(r, null, e, null, latencyMs);
    }

    public static FetchOutcome skipped(UpstreamRequest r, String reason) {
        return new FetchOutcome(r, null, null, reason, 0L);
    }

    public boolean isSuccess() {
        return quote != null;
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
