package com.stock.pulse.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
    STRONG_BUY("STRONG BUY", 80),
    BUY("BUY", 65),
    HOLD("HOLD", 50),
    AVOID("AVOID", 35),
    STRONG_AVOID("STRONG AVOID", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double floor;

    Verdict(String label, double floor) {
        this.label = label;
        this.floor = floor;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Verdict fromScore(double score) {
        for (Verdict v : values()) {
            if (score >= v.floor) return v;
        }
        return STRONG_AVOID;
    }
}
