package com.stock.pulse.engine.common.exception;

/**
 * A payload did not match any known upstream shape.
 */
public class NormalizationException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-NRM-001";

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
