package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stock.pulse.engine.common.exception.UpstreamCallException;
import com.stock.pulse.engine.enums.PayloadShape;

import java.util.Optional;

/**
 * {"status": "SUCCESS", "payload": {...}}. A FAILURE status is a definitive upstream answer
 * and is not retried.
 */
public class EnvelopePayloadDecoder implements PayloadDecoder {

    @Override
    public PayloadShape shape() {
        return PayloadShape.STATUS_ENVELOPE;
    }

    @Override
    public Optional<ObjectNode> decode(String symbol, JsonNode root) {
        if (!root.isObject() || !root.path("status").isTextual()) return Optional.empty();
        if (!root.has("payload") && !root.has("error")) return Optional.empty();

        String status = root.get("status").asText();
        if (!"SUCCESS".equalsIgnoreCase(status)) {
            JsonNode err = root.path("error");
            String msg = err.isObject() ? err.path("message").asText(err.toString()) : err.asText(status);
            throw new UpstreamCallException(symbol, 200, 0, "Upstream reported " + status + " for " + symbol + ": " + msg, null);
        }
        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject()) return Optional.empty();
        return PayloadDecoder.underSymbolKey(symbol, payload).or(() -> Optional.of((ObjectNode) payload));
    }
}
