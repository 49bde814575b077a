package com.stock.pulse.engine.enums;

public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == PARTIAL || this == FAILED;
    }

    /**
     * Allowed moves: PENDING -> RUNNING | FAILED, RUNNING -> SUCCESS | PARTIAL | FAILED.
     */
    public boolean canMoveTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
