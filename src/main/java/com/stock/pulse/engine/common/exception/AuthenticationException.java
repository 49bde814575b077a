package com.stock.pulse.engine.common.exception;

/**
 * The upstream session could not be established or was rejected twice in a row.
 * Fatal for the running extraction job.
 */
public class AuthenticationException extends BasePipelineException {
    public static final String DEFAULT_ERROR_CODE = "ERR-AUTH-101";
    public static final String NOT_CONFIGURED = "ERR-AUTH-102";

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    public AuthenticationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
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
