package com.stock.pulse.engine.service.persistence;

import java.util.ArrayList;
import java.util.List;

/**
 * Which time-series tables one record touched.
 */
public record UpsertSummary(boolean price, boolean technical, boolean fundamentals,
                            boolean shareholding, boolean technicalsComputed) {

    public List<String> tables() {
        List<String> out = new ArrayList<>(4);
        if (price) out.add("prices_daily");
        if (technical) out.add("technical_indicators");
        if (fundamentals) out.add("fundamentals_quarterly");
        if (shareholding) out.add("shareholding_quarterly");
        return out;
    }

    public boolean isEmpty() {
        return !price && !technical && !fundamentals && !shareholding;
    }
}
