package com.stock.pulse.engine.enums;

public enum ChecklistVerdict {
    PASS,
    CAUTION,
    FAIL,
    INSUFFICIENT_DATA
}
