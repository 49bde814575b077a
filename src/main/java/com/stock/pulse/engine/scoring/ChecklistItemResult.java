package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.ChecklistStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ChecklistItemResult {
    String id;
    String criterion;
    boolean dealBreaker;
    ChecklistStatus status;
    Double value;
    String missingField;
}
