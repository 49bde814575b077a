package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.enums.FieldCategory;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;

/**
 * confidence = 0.40 completeness + 0.30 freshness + 0.15 source agreement + 0.15 model confidence.
 * <p>
 * Completeness and freshness read only the record's provenance maps.
 */
public final class ConfidenceCalculator {

    public static final double W_COMPLETENESS = 0.40;
    public static final double W_FRESHNESS = 0.30;
    public static final double W_AGREEMENT = 0.15;
    public static final double W_MODEL = 0.15;

    static final Duration MARKET_HALF_LIFE = Duration.ofDays(1);
    static final Duration FUNDAMENTAL_HALF_LIFE = Duration.ofDays(45);

    private static final Set<FieldCategory> MARKET_CATEGORIES =
            Set.of(FieldCategory.PRICE_VOLUME, FieldCategory.DERIVED, FieldCategory.TECHNICAL);

    private ConfidenceCalculator() {
    }

    public static ConfidenceBreakdown compute(RuleInputs in, SubScores subScores, Set<CanonicalField> expected, Instant now) {
        CanonicalRecord r = in.record();

        int available = 0;
        double freshSum = 0;
        for (CanonicalField f : expected) {
            if (!r.isAvailable(f)) continue;
            Optional<Instant> at = r.lastUpdated(f);
            if (at.isEmpty()) continue;
            available++;
            freshSum += decay(Duration.between(at.get(), now), halfLife(f));
        }
        double completeness = expected.isEmpty() ? 0.0 : available * 100.0 / expected.size();
        double freshness = available == 0 ? 0.0 : freshSum / available;

        List<Boolean> checks = agreementChecks(in);
        double agreement = checks.isEmpty() ? 50.0
                : checks.stream().filter(Boolean::booleanValue).count() * 100.0 / checks.size();

        double model = modelConfidence(subScores);

        completeness = SubScoreCalculator.round2(completeness);
        freshness = SubScoreCalculator.round2(freshness);
        agreement = SubScoreCalculator.round2(agreement);
        model = SubScoreCalculator.round2(model);
        double score = W_COMPLETENESS * completeness + W_FRESHNESS * freshness + W_AGREEMENT * agreement + W_MODEL * model;

        return ConfidenceBreakdown.builder()
                .score(SubScoreCalculator.round2(SubScoreCalculator.clamp(score)))
                .completeness(completeness)
                .freshness(freshness)
                .sourceAgreement(agreement)
                .modelConfidence(model)
                .expectedFields(expected.size())
                .availableFields(available)
                .agreementChecks(checks.size())
                .build();
    }

    /**
     * 100 minus twice the spread of the data-backed sub-scores; 50 with fewer than two of them.
     */
    public static double modelConfidence(SubScores subScores) {
        List<Double> s = new ArrayList<>();
        for (SubScore sub : subScores.all()) if (sub.isFromData()) s.add(sub.getScore());
        if (s.size() < 2) return 50.0;
        double mean = s.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double var = s.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / s.size();
        return SubScoreCalculator.clamp(100.0 - 2.0 * Math.sqrt(var));
    }

    static double decay(Duration age, Duration halfLife) {
        double ageMs = Math.max(0L, age.toMillis());
        return 100.0 * Math.pow(0.5, ageMs / (double) halfLife.toMillis());
    }

    static Duration halfLife(CanonicalField f) {
        return MARKET_CATEGORIES.contains(f.category()) ? MARKET_HALF_LIFE : FUNDAMENTAL_HALF_LIFE;
    }

    // only pairs where both sides exist count as checks
    private static List<Boolean> agreementChecks(RuleInputs in) {
        HistoricalAggregates h = in.history();
        List<Boolean> out = new ArrayList<>();
        check(out, in.price(), h.getLastStoredClose(), 0.05);
        check(out, in.number(WEEK_52_HIGH), h.getHigh52w(), 0.05);
        check(out, in.number(WEEK_52_LOW), h.getLow52w(), 0.05);
        check(out, in.number(SMA_50), h.getSma50(), 0.02);
        check(out, in.number(SMA_200), h.getSma200(), 0.02);
        check(out, in.number(AVG_VOLUME_20D), h.getAvgVolume20d(), 0.20);
        check(out, in.number(SECTOR_PE), h.getSectorPe(), 0.10);
        return out;
    }

    private static void check(List<Boolean> out, Optional<Double> live, Double stored, double tolerance) {
        if (live.isEmpty() || stored == null || stored == 0.0) return;
        out.add(Math.abs(live.get() - stored) / Math.abs(stored) <= tolerance);
    }
}
