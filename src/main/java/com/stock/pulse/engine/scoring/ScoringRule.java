package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.RuleKind;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import lombok.Builder;
import lombok.Value;

/**
 * One deal-breaker, penalty or booster. Magnitudes are ignored for deal-breakers.
 */
@Value
@Builder
public class ScoringRule {
    String id;
    RuleKind kind;
    String description;
    RuleCondition condition;
    /** field shown as the observed value, may be null */
    CanonicalField field;
    String threshold;
    double shortTerm;
    double longTerm;
}
