package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.common.exception.ScoringInputIncompleteException;

/**
 * Predicate of a scoring rule or checklist item.
 */
@FunctionalInterface
public interface RuleCondition {

    /**
     * @throws ScoringInputIncompleteException when a needed input is missing
     */
    boolean test(RuleInputs in);

    /**
     * Left to right: a determinate false on the left decides without reading the right side.
     */
    default RuleCondition and(RuleCondition other) {
        return in -> test(in) && other.test(in);
    }
}
