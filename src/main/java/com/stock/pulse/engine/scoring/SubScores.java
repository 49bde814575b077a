package com.stock.pulse.engine.scoring;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class SubScores {

    /** short-term weights in F, V, T, Q, R order */
    public static final double[] SHORT_TERM_WEIGHTS = {0.10, 0.10, 0.45, 0.10, 0.25};
    public static final double[] LONG_TERM_WEIGHTS = {0.30, 0.20, 0.05, 0.25, 0.20};

    SubScore fundamental;
    SubScore valuation;
    SubScore technical;
    SubScore quality;
    /** higher is safer */
    SubScore risk;

    public List<SubScore> all() {
        return List.of(fundamental, valuation, technical, quality, risk);
    }

    public double shortTermComposite() {
        return weighted(SHORT_TERM_WEIGHTS);
    }

    public double longTermComposite() {
        return weighted(LONG_TERM_WEIGHTS);
    }

    private double weighted(double[] w) {
        List<SubScore> s = all();
        double sum = 0;
        for (int i = 0; i < w.length; i++) sum += w[i] * s.get(i).getScore();
        return sum;
    }
}
