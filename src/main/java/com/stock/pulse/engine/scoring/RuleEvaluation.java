package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.RuleKind;
import com.stock.pulse.engine.enums.RuleStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RuleEvaluation {
    String id;
    RuleKind kind;
    String description;
    RuleStatus status;
    Double value;
    String threshold;
    /** magnitude this rule contributes when triggered, before any cap */
    double shortTermImpact;
    double longTermImpact;
    String missingField;

    public boolean isTriggered() {
        return status == RuleStatus.TRIGGERED;
    }
}
