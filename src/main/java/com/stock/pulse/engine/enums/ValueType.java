package com.stock.pulse.engine.enums;

/**
 * Java representation of each canonical value:
 * NUMBER -> Double, TEXT -> String, BOOLEAN -> Boolean, DATE -> LocalDate, TIMESTAMP -> Instant.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    DATE,
    TIMESTAMP
}
