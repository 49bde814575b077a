package com.stock.pulse.engine.common.exception;

import lombok.Getter;

/**
 * A storage tier rejected a write. Only raised for authoritative tiers.
 */
@Getter
public class PersistenceTierUnavailableException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-101";

    private final String tier;

    public PersistenceTierUnavailableException(String tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }

    @Override
    public boolean isFatalForJob() {
        return true;
    }
}
