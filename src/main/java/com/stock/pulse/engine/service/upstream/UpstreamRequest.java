package com.stock.pulse.engine.service.upstream;

import java.util.Locale;
import java.util.Objects;

/**
 * One quote lookup: trading symbol on an exchange segment.
 */
public record UpstreamRequest(String symbol, String exchange, String segment) {

    public UpstreamRequest {
        Objects.requireNonNull(symbol, "symbol");
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static UpstreamRequest of(String symbol, String exchange, String segment) {
        return new UpstreamRequest(symbol, exchange, segment);
    }
}
