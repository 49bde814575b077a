package com.stock.pulse.engine.enums;

public enum RuleStatus {
    TRIGGERED,
    NOT_TRIGGERED,
    /** not enough data to decide */
    INDETERMINATE
}
