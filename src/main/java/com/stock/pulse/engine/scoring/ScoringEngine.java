package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.Verdict;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;

import java.time.Instant;
import java.util.List;

/**
 * Deterministic scorer. No I/O: the same record, history and instant give the same result.
 * <p>
 * Steps run in a fixed order, each on the output of the previous one:
 * sub-scores, deal-breakers, penalties, boosters, model adjustment, clamp, confidence, checklists.
 */
public final class ScoringEngine {

    private ScoringEngine() {
    }

    public static ScoreResult score(CanonicalRecord record, HistoricalAggregates history, Instant now) {
        RuleInputs in = new RuleInputs(record, history);

        // 1) Sub-scores and base composites
        SubScores subs = SubScoreCalculator.compute(in);
        double baseShort = subs.shortTermComposite();
        double baseLong = subs.longTermComposite();

        // 2) Deal-breakers set a ceiling that holds through every later step
        List<RuleEvaluation> dealBreakers = RuleInterpreter.evaluate(RuleBook.DEAL_BREAKERS, in);
        boolean broken = dealBreakers.stream().anyMatch(RuleEvaluation::isTriggered);
        double ceiling = broken ? RuleBook.DEAL_BREAKER_CEILING : 100.0;

        // 3) Penalties, cumulative and unbounded until the final clamp
        List<RuleEvaluation> penalties = RuleInterpreter.evaluate(RuleBook.RISK_PENALTIES, in);
        double penShort = RuleInterpreter.sumShort(penalties);
        double penLong = RuleInterpreter.sumLong(penalties);

        // 4) Boosters, capped as a sum per horizon
        List<RuleEvaluation> boosters = RuleInterpreter.evaluate(RuleBook.QUALITY_BOOSTERS, in);
        double boostShort = Math.min(RuleBook.BOOSTER_CAP, RuleInterpreter.sumShort(boosters));
        double boostLong = Math.min(RuleBook.BOOSTER_CAP, RuleInterpreter.sumLong(boosters));

        // 5) Model-confidence adjustment in [-10, +10]
        double model = ConfidenceCalculator.modelConfidence(subs);
        double adjustment = Math.max(-10.0, Math.min(10.0, (model - 50.0) / 5.0));

        // 6) Clamp under the ceiling, verdict from the long-term score
        double shortScore = finalScore(baseShort - penShort + boostShort + adjustment, ceiling);
        double longScore = finalScore(baseLong - penLong + boostLong + adjustment, ceiling);

        // 7) Confidence
        ConfidenceBreakdown confidence = ConfidenceCalculator.compute(in, subs, SubScoreCalculator.EXPECTED_FIELDS, now);

        // 8) Checklists
        ChecklistReport shortList = Checklists.evaluate("short_term", Checklists.SHORT_TERM, in);
        ChecklistReport longList = Checklists.evaluate("long_term", Checklists.LONG_TERM, in);

        return ScoreResult.builder()
                .symbol(record.getSymbol())
                .asOf(record.getAsOf())
                .computedAt(now)
                .shortTermScore(shortScore)
                .longTermScore(longScore)
                .verdict(Verdict.fromScore(longScore))
                .confidence(confidence)
                .subScores(subs)
                .baseShortTerm(SubScoreCalculator.round2(baseShort))
                .baseLongTerm(SubScoreCalculator.round2(baseLong))
                .dealBreakers(dealBreakers)
                .riskPenalties(penalties)
                .qualityBoosters(boosters)
                .dealBreakerTriggered(broken)
                .scoreCeiling(ceiling)
                .penaltyShortTerm(penShort)
                .penaltyLongTerm(penLong)
                .boosterShortTerm(boostShort)
                .boosterLongTerm(boostLong)
                .modelAdjustment(SubScoreCalculator.round2(adjustment))
                .shortTermChecklist(shortList)
                .longTermChecklist(longList)
                .build();
    }

    private static double finalScore(double raw, double ceiling) {
        return SubScoreCalculator.round2(Math.min(ceiling, SubScoreCalculator.clamp(raw)));
    }
}
