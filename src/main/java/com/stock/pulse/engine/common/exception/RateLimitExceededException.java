package com.stock.pulse.engine.common.exception;

/**
 * Upstream answered 429. Retried with backoff like any transient failure.
 */
public class RateLimitExceededException extends TransientNetworkException {
    private static final String DEFAULT_ERROR_CODE = "ERR-UPS-429";

    public RateLimitExceededException(String message) {
        super(429, message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
