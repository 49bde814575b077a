package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.common.exception.ScoringInputIncompleteException;
import com.stock.pulse.engine.enums.ChecklistStatus;
import com.stock.pulse.engine.enums.ChecklistVerdict;

import java.util.ArrayList;
import java.util.List;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;
import static com.stock.pulse.engine.scoring.Conditions.*;

/**
 * Short-horizon (S1-S8) and long-horizon (L1-L10) checklists.
 */
public final class Checklists {

    public static final double PASS_PERCENT = 70.0;
    public static final double CAUTION_PERCENT = 50.0;

    public static final List<ChecklistItem> SHORT_TERM = List.of(
            new ChecklistItem("S1", "Price above 20-day average", false, priceAbove(SMA_20), SMA_20),
            new ChecklistItem("S2", "Price above 50-day average", false, priceAbove(SMA_50), SMA_50),
            new ChecklistItem("S3", "RSI between 40 and 70", false, between(RSI_14, 40.0, 70.0), RSI_14),
            new ChecklistItem("S4", "MACD above signal line", false, fieldAbove(MACD, MACD_SIGNAL), MACD),
            new ChecklistItem("S5", "Volume at or above 20-day average", false, atLeast(VOLUME_RATIO, 1.0), VOLUME_RATIO),
            new ChecklistItem("S6", "Delivery at least 35% of volume", false, atLeast(DELIVERY_PCT, 35.0), DELIVERY_PCT),
            new ChecklistItem("S7", "No pending regulatory action", true, isFalse(REGULATORY_ACTION), null),
            new ChecklistItem("S8", "Promoter pledging under 25%", true, below(PROMOTER_PLEDGING, 25.0), PROMOTER_PLEDGING)
    );

    public static final List<ChecklistItem> LONG_TERM = List.of(
            new ChecklistItem("L1", "ROE at least 15%", false, atLeast(ROE, 15.0), ROE),
            new ChecklistItem("L2", "ROCE at least 15%", false, atLeast(ROCE, 15.0), ROCE),
            new ChecklistItem("L3", "Debt to equity at most 1", true, atMost(DEBT_TO_EQUITY, 1.0), DEBT_TO_EQUITY),
            new ChecklistItem("L4", "Interest coverage at least 3x", true, atLeast(INTEREST_COVERAGE, 3.0), INTEREST_COVERAGE),
            new ChecklistItem("L5", "Revenue growth at least 10%", false, atLeast(REVENUE_GROWTH_YOY, 10.0), REVENUE_GROWTH_YOY),
            new ChecklistItem("L6", "Profit growth at least 10%", false, atLeast(PROFIT_GROWTH_YOY, 10.0), PROFIT_GROWTH_YOY),
            new ChecklistItem("L7", "Positive free cash flow", false, above(FREE_CASH_FLOW, 0.0), FREE_CASH_FLOW),
            new ChecklistItem("L8", "Promoter holding at least 40%", false, atLeast(PROMOTER_HOLDING, 40.0), PROMOTER_HOLDING),
            new ChecklistItem("L9", "Promoter pledging at most 10%", true, atMost(PROMOTER_PLEDGING, 10.0), PROMOTER_PLEDGING),
            new ChecklistItem("L10", "P/E within 1.5x of sector", false, peAtMostSector(1.5), PE_RATIO)
    );

    private Checklists() {
    }

    public static ChecklistReport evaluate(String horizon, List<ChecklistItem> items, RuleInputs in) {
        List<ChecklistItemResult> results = new ArrayList<>(items.size());
        int passed = 0;
        int failed = 0;
        int indeterminate = 0;
        int dealBreakerFailures = 0;

        for (ChecklistItem item : items) {
            ChecklistItemResult.ChecklistItemResultBuilder b = ChecklistItemResult.builder()
                    .id(item.id())
                    .criterion(item.criterion())
                    .dealBreaker(item.dealBreaker())
                    .value(item.field() == null ? null : in.number(item.field()).orElse(null));
            try {
                if (item.condition().test(in)) {
                    passed++;
                    b.status(ChecklistStatus.PASS);
                } else {
                    failed++;
                    if (item.dealBreaker()) dealBreakerFailures++;
                    b.status(ChecklistStatus.FAIL);
                }
            } catch (ScoringInputIncompleteException e) {
                indeterminate++;
                b.status(ChecklistStatus.INDETERMINATE).missingField(e.getField());
            }
            results.add(b.build());
        }

        int determinate = passed + failed;
        double pct = determinate == 0 ? 0.0 : SubScoreCalculator.round2(passed * 100.0 / determinate);
        return ChecklistReport.builder()
                .horizon(horizon)
                .items(results)
                .passed(passed)
                .failed(failed)
                .indeterminate(indeterminate)
                .dealBreakerFailures(dealBreakerFailures)
                .scorePercent(pct)
                .verdict(verdict(determinate, dealBreakerFailures, pct))
                .build();
    }

    static ChecklistVerdict verdict(int determinate, int dealBreakerFailures, double pct) {
        if (determinate == 0) return ChecklistVerdict.INSUFFICIENT_DATA;
        if (dealBreakerFailures > 0) return ChecklistVerdict.FAIL;
        if (pct >= PASS_PERCENT) return ChecklistVerdict.PASS;
        if (pct >= CAUTION_PERCENT) return ChecklistVerdict.CAUTION;
        return ChecklistVerdict.FAIL;
    }
}
