package com.stock.pulse.engine.enums;

public enum SymbolStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
