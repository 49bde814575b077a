package com.stock.pulse.engine.enums;

public enum RuleKind {
    DEAL_BREAKER,
    PENALTY,
    BOOSTER
}
