package com.stock.pulse.engine.common.exception;

import lombok.Getter;

/**
 * A scoring rule needed a field the record does not have.
 * Caught by the rule interpreter, which marks the rule indeterminate.
 */
@Getter
public class ScoringInputIncompleteException extends BasePipelineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SCR-001";

    private final String field;

    public ScoringInputIncompleteException(String field) {
        super("Missing scoring input: " + field);
        this.field = field;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
