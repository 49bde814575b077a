package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.model.canonical.CanonicalField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;

/**
 * Five sub-scores, each the mean of its available components. Components map one metric
 * linearly onto 0-100 between a "worst" and a "best" value, clamped at both ends.
 */
public final class SubScoreCalculator {

    public static final double NEUTRAL = 50.0;

    private record Component(Set<CanonicalField> inputs, Function<RuleInputs, Optional<Double>> score) {
    }

    private static final List<Component> FUNDAMENTAL = List.of(
            linear(REVENUE_GROWTH_YOY, -10, 30),
            linear(PROFIT_GROWTH_YOY, -20, 40),
            linear(EPS_GROWTH_YOY, -20, 40),
            linear(NET_PROFIT_MARGIN, 0, 25),
            new Component(EnumSet.of(FREE_CASH_FLOW),
                    in -> in.number(FREE_CASH_FLOW).map(v -> v > 0 ? 80.0 : 20.0))
    );

    private static final List<Component> VALUATION = List.of(
            new Component(EnumSet.of(PE_RATIO, SECTOR_PE), in -> in.number(PE_RATIO)
                    .filter(pe -> pe > 0)
                    .flatMap(pe -> in.sectorPe().filter(s -> s > 0).map(s -> scale(pe / s, 2.0, 0.5)))),
            linear(PB_RATIO, 8, 1),
            linear(EV_EBITDA, 30, 5),
            linear(PEG_RATIO, 3, 0.5),
            linear(DIVIDEND_YIELD, 0, 4)
    );

    private static final List<Component> TECHNICAL = List.of(
            new Component(EnumSet.of(RSI_14), in -> in.number(RSI_14).map(r -> clamp(100 - Math.abs(r - 55) * 2.5))),
            priceVersus(SMA_50, -10, 10),
            priceVersus(SMA_200, -20, 20),
            new Component(EnumSet.of(MACD, MACD_SIGNAL), in -> in.number(MACD)
                    .flatMap(m -> in.number(MACD_SIGNAL).map(s -> m > s ? 75.0 : 25.0))),
            linear(PCT_FROM_52W_HIGH, -40, 0),
            linear(VOLUME_RATIO, 0.5, 2.0)
    );

    private static final List<Component> QUALITY = List.of(
            linear(ROE, 0, 25),
            linear(ROCE, 0, 25),
            linear(OPERATING_MARGIN, 0, 30),
            linear(INTEREST_COVERAGE, 1, 10),
            linear(PROMOTER_HOLDING, 20, 70)
    );

    private static final List<Component> RISK = List.of(
            linear(DEBT_TO_EQUITY, 2, 0),
            linear(VOLATILITY_30D, 60, 15),
            linear(PROMOTER_PLEDGING, 50, 0),
            linear(CURRENT_RATIO, 0.8, 2.0),
            linear(BETA, 1.8, 0.7)
    );

    /**
     * Every field some component reads; the confidence completeness term is measured against it.
     */
    public static final Set<CanonicalField> EXPECTED_FIELDS;

    static {
        Set<CanonicalField> all = EnumSet.noneOf(CanonicalField.class);
        for (List<Component> group : List.of(FUNDAMENTAL, VALUATION, TECHNICAL, QUALITY, RISK)) {
            group.forEach(c -> all.addAll(c.inputs()));
        }
        all.add(LAST_PRICE);
        EXPECTED_FIELDS = Collections.unmodifiableSet(all);
    }

    private SubScoreCalculator() {
    }

    public static SubScores compute(RuleInputs in) {
        return SubScores.builder()
                .fundamental(score("fundamental", FUNDAMENTAL, in))
                .valuation(score("valuation", VALUATION, in))
                .technical(score("technical", TECHNICAL, in))
                .quality(score("quality", QUALITY, in))
                .risk(score("risk", RISK, in))
                .build();
    }

    private static SubScore score(String name, List<Component> components, RuleInputs in) {
        List<Double> values = new ArrayList<>();
        for (Component c : components) c.score().apply(in).ifPresent(values::add);
        double s = values.isEmpty() ? NEUTRAL : values.stream().mapToDouble(Double::doubleValue).average().orElse(NEUTRAL);
        return SubScore.builder()
                .name(name)
                .score(round2(s))
                .componentsUsed(values.size())
                .componentsTotal(components.size())
                .build();
    }

    // worst maps to 0, best to 100; works for either direction
    private static Component linear(CanonicalField f, double worst, double best) {
        return new Component(EnumSet.of(f), in -> in.number(f).map(v -> scale(v, worst, best)));
    }

    private static Component priceVersus(CanonicalField average, double worstPct, double bestPct) {
        return new Component(EnumSet.of(LAST_PRICE, average), in -> in.price()
                .flatMap(p -> in.number(average).filter(a -> a > 0).map(a -> scale((p - a) / a * 100.0, worstPct, bestPct))));
    }

    static double scale(double v, double worst, double best) {
        return clamp((v - worst) / (best - worst) * 100.0);
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
