package com.stock.pulse.engine.common.exception;

import lombok.Getter;

/**
 * A single upstream call failed for good, either after retries ran out or
 * because the provider answered with a non-retriable error.
 */
@Getter
public class UpstreamCallException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-UPS-002";

    private final String symbol;
    private final int lastStatus;
    private final int attempts;

    public UpstreamCallException(String symbol, int lastStatus, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.lastStatus = lastStatus;
        this.attempts = attempts;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
