package com.stock.pulse.engine.common.exception;

import lombok.Getter;

/**
 * Base exception for the extraction pipeline and the scoring engine.
 * Every subclass carries a stable error code that the web layer maps to an HTTP status.
 */
@Getter
public abstract class BasePipelineException extends RuntimeException {

    private final String errorCode;

    protected BasePipelineException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BasePipelineException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BasePipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode == null ? getDefaultErrorCode() : errorCode;
    }

    /**
     * Each subclass provides its default error code.
     */
    protected abstract String getDefaultErrorCode();

    /**
     * Whether the failure should stop the whole job rather than a single symbol.
     */
    public boolean isFatalForJob() {
        return false;
    }
}
