package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.model.canonical.CanonicalField;

/**
 * One checklist criterion. A failed deal-breaker item fails the whole checklist.
 */
public record ChecklistItem(String id, String criterion, boolean dealBreaker, RuleCondition condition,
                            CanonicalField field) {
}
