package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stock.pulse.engine.enums.PayloadShape;

import java.time.Instant;

/**
 * A decoded quote, unwrapped from whatever envelope the upstream used.
 */
public record UpstreamQuote(String symbol,
                            PayloadShape shape,
                            ObjectNode fields,
                            Instant receivedAt,
                            long latencyMs,
                            int attempts) {
}
