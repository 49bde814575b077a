package com.stock.pulse.engine.common.exception;

public class EntityNotFoundException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-NOT-FOUND";

    public EntityNotFoundException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
