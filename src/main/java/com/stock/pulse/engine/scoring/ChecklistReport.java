package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.ChecklistVerdict;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Indeterminate items are reported but left out of {@code scorePercent}.
 */
@Value
@Builder
@Jacksonized
public class ChecklistReport {
    String horizon;
    List<ChecklistItemResult> items;
    int passed;
    int failed;
    int indeterminate;
    int dealBreakerFailures;
    /** passed / (passed + failed), 0 when nothing is determinate */
    double scorePercent;
    ChecklistVerdict verdict;
}
