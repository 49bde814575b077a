package com.stock.pulse.engine.scoring;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One 0-100 sub-score. {@code componentsUsed == 0} means no data and the neutral 50.
 */
@Value
@Builder
@Jacksonized
public class SubScore {
    String name;
    double score;
    int componentsUsed;
    int componentsTotal;

    public boolean isFromData() {
        return componentsUsed > 0;
    }
}
