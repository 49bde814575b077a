package com.stock.pulse.engine.test.scoring;

import com.stock.pulse.engine.enums.RuleStatus;
import com.stock.pulse.engine.enums.Verdict;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.scoring.ConfidenceBreakdown;
import com.stock.pulse.engine.scoring.HistoricalAggregates;
import com.stock.pulse.engine.scoring.RuleBook;
import com.stock.pulse.engine.scoring.RuleEvaluation;
import com.stock.pulse.engine.scoring.ScoreResult;
import com.stock.pulse.engine.scoring.ScoringEngine;
import com.stock.pulse.engine.scoring.SubScoreCalculator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-14T10:00:00Z");

    // every booster condition holds, nothing else triggers
    private static CanonicalRecord strongCompany() {
        CanonicalRecord r = new CanonicalRecord("GOODCO", NOW);
        put(r, LAST_PRICE, 120.0);
        put(r, SMA_50, 110.0);
        put(r, SMA_200, 100.0);
        put(r, ROE, 25.0);
        put(r, ROCE, 25.0);
        put(r, DEBT_TO_EQUITY, 0.05);
        put(r, REVENUE_GROWTH_YOY, 20.0);
        put(r, PROFIT_GROWTH_YOY, 25.0);
        put(r, FREE_CASH_FLOW, 1.0e9);
        put(r, PROMOTER_HOLDING, 60.0);
        put(r, PROMOTER_PLEDGING, 0.0);
        put(r, DIVIDEND_YIELD, 3.0);
        put(r, INTEREST_COVERAGE, 12.0);
        put(r, CURRENT_RATIO, 2.2);
        put(r, OPERATING_MARGIN, 22.0);
        put(r, RSI_14, 58.0);
        put(r, AVG_VOLUME_20D, 2_000_000.0);
        return r;
    }

    private static void put(CanonicalRecord r, CanonicalField f, Object v) {
        r.put(f, v, NOW);
    }

    @Test
    void boostersAreCappedAsASumPerHorizon() {
        ScoreResult s = ScoringEngine.score(strongCompany(), HistoricalAggregates.EMPTY, NOW);

        assertThat(s.getQualityBoosters()).allMatch(RuleEvaluation::isTriggered);
        assertThat(s.getBoosterShortTerm()).isEqualTo(29.0);
        assertThat(s.getBoosterLongTerm()).isEqualTo(RuleBook.BOOSTER_CAP);
        assertThat(s.isDealBreakerTriggered()).isFalse();
        assertThat(s.getScoreCeiling()).isEqualTo(100.0);
    }

    @Test
    void dealBreakerCeilingHoldsEvenWithEveryBooster() {
        CanonicalRecord r = strongCompany();
        put(r, INTEREST_COVERAGE, 1.5);

        ScoreResult s = ScoringEngine.score(r, HistoricalAggregates.EMPTY, NOW);

        RuleEvaluation d1 = s.getDealBreakers().stream().filter(e -> "D1".equals(e.getId())).findFirst().orElseThrow();
        assertThat(d1.getStatus()).isEqualTo(RuleStatus.TRIGGERED);
        assertThat(s.isDealBreakerTriggered()).isTrue();
        assertThat(s.getBoosterLongTerm()).isEqualTo(RuleBook.BOOSTER_CAP);
        assertThat(s.getShortTermScore()).isLessThanOrEqualTo(RuleBook.DEAL_BREAKER_CEILING);
        assertThat(s.getLongTermScore()).isLessThanOrEqualTo(RuleBook.DEAL_BREAKER_CEILING);
        assertThat(s.getVerdict()).isIn(Verdict.AVOID, Verdict.STRONG_AVOID);
    }

    @Test
    void scoresStayWithinBoundsUnderHeavyPenalties() {
        CanonicalRecord r = new CanonicalRecord("WEAKCO", NOW);
        put(r, LAST_PRICE, 50.0);
        put(r, SMA_200, 100.0);
        put(r, RSI_14, 90.0);
        put(r, DEBT_TO_EQUITY, 1.8);
        put(r, PROMOTER_PLEDGING, 40.0);
        put(r, VOLATILITY_30D, 80.0);
        put(r, PROFIT_GROWTH_YOY, -40.0);
        put(r, PROMOTER_HOLDING_CHANGE, -5.0);
        put(r, OPERATING_MARGIN, 1.0);
        put(r, DELIVERY_PCT, 10.0);
        put(r, PE_RATIO, 90.0);
        put(r, SECTOR_PE, 20.0);

        ScoreResult s = ScoringEngine.score(r, HistoricalAggregates.EMPTY, NOW);

        assertThat(s.getRiskPenalties()).allMatch(RuleEvaluation::isTriggered);
        assertThat(s.getPenaltyShortTerm()).isEqualTo(48.0);
        assertThat(s.getPenaltyLongTerm()).isEqualTo(49.0);
        assertThat(s.getShortTermScore()).isBetween(0.0, 100.0);
        assertThat(s.getLongTermScore()).isBetween(0.0, 100.0);
    }

    @Test
    void recordWithoutInputsScoresNeutralAndNeverTriggers() {
        CanonicalRecord r = new CanonicalRecord("BARE", NOW);
        put(r, LAST_PRICE, 100.0);

        ScoreResult s = ScoringEngine.score(r, HistoricalAggregates.EMPTY, NOW);

        assertThat(s.getDealBreakers()).allMatch(e -> e.getStatus() == RuleStatus.INDETERMINATE);
        assertThat(s.getRiskPenalties()).noneMatch(RuleEvaluation::isTriggered);
        assertThat(s.getQualityBoosters()).noneMatch(RuleEvaluation::isTriggered);
        assertThat(s.getSubScores().all()).allMatch(sub -> sub.getScore() == SubScoreCalculator.NEUTRAL);
        assertThat(s.getModelAdjustment()).isEqualTo(0.0);
        assertThat(s.getShortTermScore()).isEqualTo(50.0);
        assertThat(s.getLongTermScore()).isEqualTo(50.0);
        assertThat(s.getVerdict()).isEqualTo(Verdict.HOLD);
    }

    @Test
    void indeterminateRuleReportsTheMissingField() {
        CanonicalRecord r = new CanonicalRecord("HALF", NOW);
        put(r, NET_PROFIT, -10.0);

        ScoreResult s = ScoringEngine.score(r, HistoricalAggregates.EMPTY, NOW);

        RuleEvaluation d4 = s.getDealBreakers().stream().filter(e -> "D4".equals(e.getId())).findFirst().orElseThrow();
        assertThat(d4.getStatus()).isEqualTo(RuleStatus.INDETERMINATE);
        assertThat(d4.getMissingField()).isEqualTo(OPERATING_CASH_FLOW.key());
        assertThat(s.isDealBreakerTriggered()).isFalse();
    }

    @Test
    void sameInputsGiveTheSameResult() {
        CanonicalRecord r = strongCompany();
        HistoricalAggregates h = HistoricalAggregates.builder().lastStoredClose(119.0).sma50(110.5).barCount(300).build();

        ScoreResult a = ScoringEngine.score(r, h, NOW);
        ScoreResult b = ScoringEngine.score(r, h, NOW);

        assertThat(a).isEqualTo(b);
    }

    @Test
    void confidenceIsTheWeightedSumOfItsTerms() {
        CanonicalRecord r = strongCompany();
        HistoricalAggregates h = HistoricalAggregates.builder()
                .lastStoredClose(121.0)
                .sma50(110.0)
                .sma200(130.0)
                .barCount(260)
                .build();

        ConfidenceBreakdown c = ScoringEngine.score(r, h, NOW).getConfidence();

        double expected = 0.40 * c.getCompleteness() + 0.30 * c.getFreshness()
                + 0.15 * c.getSourceAgreement() + 0.15 * c.getModelConfidence();
        assertThat(c.getScore()).isCloseTo(expected, within(0.01));
        assertThat(c.getFreshness()).isEqualTo(100.0);
        assertThat(c.getAgreementChecks()).isEqualTo(3);
        // price and SMA50 agree, SMA200 is 23% off
        assertThat(c.getSourceAgreement()).isCloseTo(66.67, within(0.01));
        assertThat(c.getExpectedFields()).isEqualTo(SubScoreCalculator.EXPECTED_FIELDS.size());
        assertThat(c.getAvailableFields()).isLessThan(c.getExpectedFields());
    }

    @Test
    void staleFundamentalsLowerFreshness() {
        CanonicalRecord fresh = new CanonicalRecord("X", NOW);
        fresh.put(ROE, 18.0, NOW);
        CanonicalRecord stale = new CanonicalRecord("X", NOW);
        stale.put(ROE, 18.0, NOW.minusSeconds(45L * 24 * 3600));

        double f1 = ScoringEngine.score(fresh, HistoricalAggregates.EMPTY, NOW).getConfidence().getFreshness();
        double f2 = ScoringEngine.score(stale, HistoricalAggregates.EMPTY, NOW).getConfidence().getFreshness();

        assertThat(f1).isEqualTo(100.0);
        // one fundamental half-life old
        assertThat(f2).isCloseTo(50.0, within(0.01));
    }

    @Test
    void agreementIsNeutralWithoutHistory() {
        ScoreResult s = ScoringEngine.score(strongCompany(), HistoricalAggregates.EMPTY, NOW);

        assertThat(s.getConfidence().getAgreementChecks()).isZero();
        assertThat(s.getConfidence().getSourceAgreement()).isEqualTo(50.0);
        assertThat(s.getDealBreakers()).extracting(RuleEvaluation::getId)
                .containsExactlyElementsOf(List.of("D1", "D2", "D3", "D4", "D5", "D6", "D7", "D8", "D9", "D10"));
    }
}
