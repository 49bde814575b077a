package com.stock.pulse.engine.common.exception;

import lombok.Getter;

/**
 * Retriable upstream failure: I/O error, timeout, 5xx or an unreadable body.
 */
@Getter
public class TransientNetworkException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-UPS-001";

    /**
     * Last HTTP status seen, or 0 when no response was received.
     */
    private final int status;

    public TransientNetworkException(int status, String message) {
        super(message);
        this.status = status;
    }

    public TransientNetworkException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
