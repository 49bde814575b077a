package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.RuleKind;
import com.stock.pulse.engine.model.canonical.CanonicalField;

import java.util.List;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;
import static com.stock.pulse.engine.scoring.Conditions.*;

/**
 * The scoring rules as data: 10 deal-breakers, 10 risk penalties, 9 quality boosters.
 * Magnitudes are points on the 0-100 composite, short-term then long-term.
 */
public final class RuleBook {

    public static final double DEAL_BREAKER_CEILING = 35.0;
    public static final double BOOSTER_CAP = 30.0;

    public static final List<ScoringRule> DEAL_BREAKERS = List.of(
            dealBreaker("D1", "Interest coverage below 2x", below(INTEREST_COVERAGE, 2.0), INTEREST_COVERAGE, "< 2.0"),
            dealBreaker("D2", "Debt to equity above 2", above(DEBT_TO_EQUITY, 2.0), DEBT_TO_EQUITY, "> 2.0"),
            dealBreaker("D3", "More than half of promoter holding pledged", above(PROMOTER_PLEDGING, 50.0), PROMOTER_PLEDGING, "> 50%"),
            dealBreaker("D4", "Loss-making with negative operating cash flow",
                    below(NET_PROFIT, 0.0).and(below(OPERATING_CASH_FLOW, 0.0)), NET_PROFIT, "< 0 and CFO < 0"),
            dealBreaker("D5", "Regulatory action pending", isTrue(REGULATORY_ACTION), null, "true"),
            dealBreaker("D6", "Qualified audit opinion", isTrue(AUDITOR_QUALIFICATION), null, "true"),
            dealBreaker("D7", "Negative net worth", below(TOTAL_EQUITY, 0.0), TOTAL_EQUITY, "< 0"),
            dealBreaker("D8", "Current ratio below 0.5", below(CURRENT_RATIO, 0.5), CURRENT_RATIO, "< 0.5"),
            dealBreaker("D9", "Illiquid: 20-day average volume under 10,000", below(AVG_VOLUME_20D, 10_000), AVG_VOLUME_20D, "< 10000"),
            dealBreaker("D10", "Revenue down more than 25% year on year", below(REVENUE_GROWTH_YOY, -25.0), REVENUE_GROWTH_YOY, "< -25%")
    );

    public static final List<ScoringRule> RISK_PENALTIES = List.of(
            rule("R1", RuleKind.PENALTY, "RSI overbought", above(RSI_14, 75.0), RSI_14, "> 75", 8, 3),
            rule("R2", RuleKind.PENALTY, "P/E more than twice the sector", peAboveSector(2.0), PE_RATIO, "> 2x sector P/E", 4, 8),
            rule("R3", RuleKind.PENALTY, "Debt to equity above 1", above(DEBT_TO_EQUITY, 1.0), DEBT_TO_EQUITY, "> 1.0", 3, 6),
            rule("R4", RuleKind.PENALTY, "Promoter pledging above 10%", above(PROMOTER_PLEDGING, 10.0), PROMOTER_PLEDGING, "> 10%", 4, 6),
            rule("R5", RuleKind.PENALTY, "30-day volatility above 45%", above(VOLATILITY_30D, 45.0), VOLATILITY_30D, "> 45%", 8, 4),
            rule("R6", RuleKind.PENALTY, "Price below 200-day average", priceBelow(SMA_200), SMA_200, "price < SMA200", 6, 4),
            rule("R7", RuleKind.PENALTY, "Profit down more than 10% year on year", below(PROFIT_GROWTH_YOY, -10.0), PROFIT_GROWTH_YOY, "< -10%", 4, 6),
            rule("R8", RuleKind.PENALTY, "Promoters cut holding by more than 1 point", below(PROMOTER_HOLDING_CHANGE, -1.0), PROMOTER_HOLDING_CHANGE, "< -1", 5, 5),
            rule("R9", RuleKind.PENALTY, "Operating margin under 5%", below(OPERATING_MARGIN, 5.0), OPERATING_MARGIN, "< 5%", 2, 5),
            rule("R10", RuleKind.PENALTY, "Delivery under 25% of volume", below(DELIVERY_PCT, 25.0), DELIVERY_PCT, "< 25%", 4, 2)
    );

    public static final List<ScoringRule> QUALITY_BOOSTERS = List.of(
            rule("Q1", RuleKind.BOOSTER, "ROE above 20%", above(ROE, 20.0), ROE, "> 20%", 3, 6),
            rule("Q2", RuleKind.BOOSTER, "ROCE above 20%", above(ROCE, 20.0), ROCE, "> 20%", 3, 6),
            rule("Q3", RuleKind.BOOSTER, "Practically debt free", below(DEBT_TO_EQUITY, 0.1), DEBT_TO_EQUITY, "< 0.1", 2, 5),
            rule("Q4", RuleKind.BOOSTER, "Revenue growth above 15%", above(REVENUE_GROWTH_YOY, 15.0), REVENUE_GROWTH_YOY, "> 15%", 4, 5),
            rule("Q5", RuleKind.BOOSTER, "Profit growth above 20%", above(PROFIT_GROWTH_YOY, 20.0), PROFIT_GROWTH_YOY, "> 20%", 4, 5),
            rule("Q6", RuleKind.BOOSTER, "Uptrend: price above SMA50 above SMA200",
                    priceAbove(SMA_50).and(fieldAbove(SMA_50, SMA_200)), SMA_50, "price > SMA50 > SMA200", 8, 3),
            rule("Q7", RuleKind.BOOSTER, "Positive free cash flow", above(FREE_CASH_FLOW, 0.0), FREE_CASH_FLOW, "> 0", 2, 5),
            rule("Q8", RuleKind.BOOSTER, "Promoters above 50% with no pledge",
                    above(PROMOTER_HOLDING, 50.0).and(atMost(PROMOTER_PLEDGING, 0.0)), PROMOTER_HOLDING, "> 50%, pledge 0", 2, 5),
            rule("Q9", RuleKind.BOOSTER, "Dividend yield above 2%", above(DIVIDEND_YIELD, 2.0), DIVIDEND_YIELD, "> 2%", 1, 4)
    );

    private RuleBook() {
    }

    private static ScoringRule dealBreaker(String id, String description, RuleCondition condition,
                                           CanonicalField field, String threshold) {
        return rule(id, RuleKind.DEAL_BREAKER, description, condition, field, threshold, 0, 0);
    }

    private static ScoringRule rule(String id, RuleKind kind, String description, RuleCondition condition,
                                    CanonicalField field, String threshold, double shortTerm, double longTerm) {
        return ScoringRule.builder()
                .id(id)
                .kind(kind)
                .description(description)
                .condition(condition)
                .field(field)
                .threshold(threshold)
                .shortTerm(shortTerm)
                .longTerm(longTerm)
                .build();
    }
}
