package com.stock.pulse.engine.enums;

public enum PipelineState {
    IDLE,
    RUNNING,
    SCHEDULED,
    ERROR
}
