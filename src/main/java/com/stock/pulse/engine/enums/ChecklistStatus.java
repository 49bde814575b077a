package com.stock.pulse.engine.enums;

public enum ChecklistStatus {
    PASS,
    FAIL,
    INDETERMINATE
}
