package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.Verdict;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable scoring output for one symbol. Recomputed, never patched.
 */
@Value
@Builder
@Jacksonized
public class ScoreResult {
    String symbol;
    Instant asOf;
    Instant computedAt;

    double shortTermScore;
    double longTermScore;
    Verdict verdict;
    ConfidenceBreakdown confidence;

    SubScores subScores;
    double baseShortTerm;
    double baseLongTerm;

    List<RuleEvaluation> dealBreakers;
    List<RuleEvaluation> riskPenalties;
    List<RuleEvaluation> qualityBoosters;

    boolean dealBreakerTriggered;
    double scoreCeiling;
    double penaltyShortTerm;
    double penaltyLongTerm;
    /** booster additions after the cap */
    double boosterShortTerm;
    double boosterLongTerm;
    double modelAdjustment;

    ChecklistReport shortTermChecklist;
    ChecklistReport longTermChecklist;
}
