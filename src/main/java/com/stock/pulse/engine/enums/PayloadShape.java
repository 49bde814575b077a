package com.stock.pulse.engine.enums;

/**
 * Known upstream quote payload layouts.
 */
public enum PayloadShape {
    /** {"status": "SUCCESS", "payload": {...}} */
    STATUS_ENVELOPE,
    /** {"data": {...}}, {"quote": {...}} or {"RELIANCE": {...}} */
    NESTED_UNDER_KEY,
    /** quote fields at the top level */
    FLAT
}
