package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.common.exception.ScoringInputIncompleteException;
import com.stock.pulse.engine.enums.RuleStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates rules one by one. A rule lacking input is INDETERMINATE: never triggered, never a pass.
 */
public final class RuleInterpreter {

    private RuleInterpreter() {
    }

    public static List<RuleEvaluation> evaluate(List<ScoringRule> rules, RuleInputs in) {
        List<RuleEvaluation> out = new ArrayList<>(rules.size());
        for (ScoringRule rule : rules) out.add(evaluate(rule, in));
        return out;
    }

    public static RuleEvaluation evaluate(ScoringRule rule, RuleInputs in) {
        RuleEvaluation.RuleEvaluationBuilder b = RuleEvaluation.builder()
                .id(rule.getId())
                .kind(rule.getKind())
                .description(rule.getDescription())
                .threshold(rule.getThreshold())
                .value(rule.getField() == null ? null : in.number(rule.getField()).orElse(null));
        try {
            boolean triggered = rule.getCondition().test(in);
            return b.status(triggered ? RuleStatus.TRIGGERED : RuleStatus.NOT_TRIGGERED)
                    .shortTermImpact(triggered ? rule.getShortTerm() : 0.0)
                    .longTermImpact(triggered ? rule.getLongTerm() : 0.0)
                    .build();
        } catch (ScoringInputIncompleteException e) {
            return b.status(RuleStatus.INDETERMINATE).missingField(e.getField()).build();
        }
    }

    public static double sumShort(List<RuleEvaluation> evals) {
        return evals.stream().filter(RuleEvaluation::isTriggered).mapToDouble(RuleEvaluation::getShortTermImpact).sum();
    }

    public static double sumLong(List<RuleEvaluation> evals) {
        return evals.stream().filter(RuleEvaluation::isTriggered).mapToDouble(RuleEvaluation::getLongTermImpact).sum();
    }
}
