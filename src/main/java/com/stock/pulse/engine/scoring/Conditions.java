package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.model.canonical.CanonicalField;

/**
 * Threshold predicates over canonical fields.
 */
public final class Conditions {

    private Conditions() {
    }

    public static RuleCondition above(CanonicalField f, double threshold) {
        return in -> in.require(f) > threshold;
    }

    public static RuleCondition atLeast(CanonicalField f, double threshold) {
        return in -> in.require(f) >= threshold;
    }

    public static RuleCondition below(CanonicalField f, double threshold) {
        return in -> in.require(f) < threshold;
    }

    public static RuleCondition atMost(CanonicalField f, double threshold) {
        return in -> in.require(f) <= threshold;
    }

    public static RuleCondition between(CanonicalField f, double lo, double hi) {
        return in -> {
            double v = in.require(f);
            return v >= lo && v <= hi;
        };
    }

    public static RuleCondition isTrue(CanonicalField f) {
        return in -> in.requireFlag(f);
    }

    public static RuleCondition isFalse(CanonicalField f) {
        return in -> !in.requireFlag(f);
    }

    public static RuleCondition priceAbove(CanonicalField reference) {
        return in -> in.requirePrice() > in.require(reference);
    }

    public static RuleCondition priceBelow(CanonicalField reference) {
        return in -> in.requirePrice() < in.require(reference);
    }

    public static RuleCondition fieldAbove(CanonicalField left, CanonicalField right) {
        return in -> in.require(left) > in.require(right);
    }

    /**
     * P/E above {@code multiple} times the sector P/E.
     */
    public static RuleCondition peAboveSector(double multiple) {
        return in -> in.require(CanonicalField.PE_RATIO) > multiple * in.requireSectorPe();
    }

    public static RuleCondition peAtMostSector(double multiple) {
        return in -> in.require(CanonicalField.PE_RATIO) <= multiple * in.requireSectorPe();
    }
}
