package com.stock.pulse.engine.common.exception;

/**
 * Unexpected error while normalizing or persisting one symbol's quote.
 */
public class SymbolProcessingException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SYS-001";

    public SymbolProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
